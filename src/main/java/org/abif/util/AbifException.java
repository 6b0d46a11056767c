package org.abif.util;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * <h1>AbifException</h1>
 *
 * AbifException is the one central place for handling exceptions in the parser and the tallies.
 * There are two kinds of exceptions:
 * <ul>
 * <li>Severe internal errors. Things that should never happen, e.g. a corrupted ranking.</li>
 * <li>And normal input errors. For example when an ABIF text contains no votelines at all.</li>
 * </ul>
 *
 * Parsing errors are thrown immediately, so no half built model is ever returned.
 * Tallies do not throw for small or empty elections. They return an empty result instead.
 * They only throw when the ballots cannot be tallied with that method at all.
 */
@Slf4j
public class AbifException extends Exception {

	/** ABIF error code */
	@Getter
	Errors error;

	/**
	 * The offending input, e.g. the voteline that could not be parsed.
	 * May be null.
	 */
	@Getter
	String offendingValue;

	/**
	 * Error codes. Internal errors are things that should mathematically never happen.
	 */
	public enum Errors {
		// Parsing
		EMPTY_INPUT(1, false),
		NO_VOTELINES(2, false),
		UNTERMINATED_QUOTE(3, false),                // only with abif.strict-quoting=true. Otherwise the tokenizer just degrades.
		INVALID_JABMOD(4, false),                    // JSON ballot model cannot be read
		RANK_INFERENCE_FAILED(10, true),             // ranks derived from ratings contradict the ratings

		// Tallies
		UNSUPPORTED_BALLOT_TYPE(20, false),

		// general errors
		INTERNAL_ERROR(500, true);

		@Getter
		final int abifErrorCode;

		final boolean internal;

		Errors(int code, boolean internal) {
			this.abifErrorCode = code;
			this.internal = internal;
		}

		public boolean isInternal() {
			return this.internal;
		}
	}

	/**
	 * An AbifException must always have an error code and a human-readable error message
	 */
	public AbifException(Errors errCode, String msg) {
		super(msg);
		this.error = errCode;
	}

	public AbifException(Errors errCode, String msg, String offendingValue) {
		this(errCode, msg);
		this.offendingValue = offendingValue;
	}

	public AbifException(Errors errCode, String msg, Throwable childException) {
		super(msg, childException);
		this.error = errCode;
	}

	/**
	 * Supply an exception. This can be used in Optional methods, e.g.
	 * <pre>Optional.orElseThrow(AbifException.supply(AbifException.Errors.SOME_NAME, "Some message"))</pre>
	 * @param error ABIF error code
	 * @param msg Human-readable error message
	 * @return a Supplier for the AbifException
	 */
	public static Supplier<AbifException> supply(Errors error, String msg) {
		return () -> new AbifException(error, msg);
	}

	/**
	 * Supply an AbifException that will automatically log the error message when thrown.
	 * Internal errors are logged as errors, everything else on info level.
	 * @param error ABIF error code
	 * @param msg Human-readable error message
	 * @return a Supplier for the AbifException
	 */
	public static Supplier<AbifException> supplyAndLog(Errors error, String msg) {
		return () -> {
			if (error.isInternal()) {
				log.error(error.name() + ": " + msg);
			} else {
				log.info(error.name() + ": " + msg);
			}
			return new AbifException(error, msg);
		};
	}

	public static void checkOrThrow(Supplier<Boolean> p, Errors err, String message) throws AbifException {
		if (!p.get()) throw new AbifException(err, message);
	}

	public int getErrorCodeAsInt() {
		return this.error.abifErrorCode;
	}

	public String getErrorName() {
		return this.error.name();
	}

	public String toString() {
		StringBuilder b = new StringBuilder("AbifException[");
		b.append("abifErrorCode=");
		b.append(this.getErrorCodeAsInt());
		b.append(", errorName=");
		b.append(this.getErrorName());
		b.append(", msg=");
		b.append(this.getMessage());
		if (this.offendingValue != null) {
			b.append(", value=");
			b.append(this.offendingValue);
		}
		if (this.getCause() != null) {
			b.append(", cause=");
			b.append(this.getCause().toString());
		}
		b.append("]");
		return b.toString();
	}
}
