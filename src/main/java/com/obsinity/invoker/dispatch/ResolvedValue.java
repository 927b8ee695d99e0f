package com.obsinity.invoker.dispatch;

/** Outcome of a single resolver: either a value (possibly {@code null}) or "not mine". */
public final class ResolvedValue {

	private static final ResolvedValue NONE = new ResolvedValue(false, null);

	private final boolean present;
	private final Object value;

	private ResolvedValue(boolean present, Object value) {
		this.present = present;
		this.value = value;
	}

	/** The resolver declines; the next resolver in the chain is asked. */
	public static ResolvedValue none() {
		return NONE;
	}

	/** The resolver supplies {@code value}, which may be {@code null}. */
	public static ResolvedValue of(Object value) {
		return new ResolvedValue(true, value);
	}

	public boolean isPresent() {
		return present;
	}

	public Object value() {
		return value;
	}

	@Override
	public String toString() {
		return present ? "ResolvedValue[" + value + "]" : "ResolvedValue.none";
	}
}
