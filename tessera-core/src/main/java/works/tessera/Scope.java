package works.tessera;

/**
 * How many times a fixture's constructor runs, and how long the resulting value lives.
 */
public enum Scope {
	/**
	 * Every request constructs a new value, owned by the requester
	 * and torn down when the requester is done with it.
	 */
	FRESH,

	/**
	 * One value per case, shared by every requester within that case,
	 * torn down when the case ends.
	 */
	PER_CASE,

	/**
	 * One value for the whole run, shared by every case,
	 * torn down after the last case has finished.
	 */
	GLOBAL,

	/**
	 * Like {@link #PER_CASE}, for fixtures whose parameter domain is expanded into separate cases:
	 * every requester inside one expanded case shares the same value.
	 */
	MATRIX,

	/**
	 * Like {@link #MATRIX}, except every requester inside one expanded case
	 * gets its own value, as with {@link #FRESH}.
	 */
	MATRIX_UNIQUE;

	/**
	 * @return true if values of this scope are cached and shared among requesters.
	 */
	public boolean isShared() {
		return this == PER_CASE || this == GLOBAL || this == MATRIX;
	}

	/**
	 * @return true if values of this scope are cached for the duration of a single case.
	 */
	public boolean isCaseBound() {
		return this == PER_CASE || this == MATRIX;
	}
}
