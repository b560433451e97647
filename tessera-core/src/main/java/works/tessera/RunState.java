package works.tessera;

public enum RunState {
	IDLE,
	COLLECTING,
	EXECUTING,
	FINISHED,
}
