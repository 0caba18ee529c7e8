package texparse.parser;

import texparse.errors.LatexParseException;

/**
 * The outcome of running a {@link LatexParser}: a value with carryover information, or a
 * failure with a best-effort recovery value and the recovery to perform on the token reader.
 */
public abstract class ParseResult<T> {
	private final T value;
	private final CarryoverInfo carryover;

	private ParseResult(T value, CarryoverInfo carryover) {
		this.value = value;
		this.carryover = carryover == null ? CarryoverInfo.empty() : carryover;
	}

	public static <T> Success<T> success(T value) {
		return new Success<>(value, CarryoverInfo.empty());
	}

	public static <T> Success<T> success(T value, CarryoverInfo carryover) {
		return new Success<>(value, carryover);
	}

	public static <T> Failure<T> failure(LatexParseException error, T recoveryValue, CarryoverInfo carryover,
	                                     Recovery recovery) {
		return new Failure<>(error, recoveryValue, carryover, recovery);
	}

	/**
	 * Views a result as a result of a supertype. Results are immutable, so this is safe.
	 */
	@SuppressWarnings("unchecked")
	public static <T> ParseResult<T> widen(ParseResult<? extends T> result) {
		return (ParseResult<T>) result;
	}

	/**
	 * @return the parsed value, or for a failure the value to use if parsing recovers
	 */
	public T getValue() {
		return value;
	}

	public CarryoverInfo getCarryover() {
		return carryover;
	}

	public abstract boolean isSuccess();

	public static final class Success<T> extends ParseResult<T> {
		private Success(T value, CarryoverInfo carryover) {
			super(value, carryover);
		}

		@Override
		public boolean isSuccess() {
			return true;
		}
	}

	public static final class Failure<T> extends ParseResult<T> {
		private final LatexParseException error;
		private final Recovery recovery;

		private Failure(LatexParseException error, T recoveryValue, CarryoverInfo carryover, Recovery recovery) {
			super(recoveryValue, carryover);
			this.error = error;
			this.recovery = recovery;
		}

		public LatexParseException getError() {
			return error;
		}

		public Recovery getRecovery() {
			return recovery;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}
	}
}
