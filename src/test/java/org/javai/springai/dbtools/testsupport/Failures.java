package org.javai.springai.dbtools.testsupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.javai.springai.dbtools.api.ErrorKind;

/**
 * Assertion helper for calls expected to fail with a {@link DatabaseToolException}.
 */
public final class Failures {

	private Failures() {
	}

	public static DatabaseToolException expectFailure(ErrorKind kind, ThrowingCallable call) {
		Throwable thrown = catchThrowable(call);
		assertThat(thrown).isInstanceOf(DatabaseToolException.class);
		DatabaseToolException failure = (DatabaseToolException) thrown;
		assertThat(failure.kind()).isEqualTo(kind);
		return failure;
	}
}
