package works.tessera;

enum CaseState {
	COLLECTED,
	RESOLVING,
	RUNNING,
	TORN_DOWN,
	REPORTED,
}
