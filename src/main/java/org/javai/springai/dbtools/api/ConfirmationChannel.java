package org.javai.springai.dbtools.api;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Asks a human to approve a write operation. Supplied by the host (chat UI, CLI,
 * agent runtime); the gateway awaits the answer once per mutating statement.
 *
 * <p>A {@code false} answer, a {@code null} answer and a failed or cancelled stage
 * all count as a rejection.</p>
 */
@FunctionalInterface
public interface ConfirmationChannel {

	CompletionStage<Boolean> requestConfirmation(String message);

	/**
	 * Adapts a synchronous decision, e.g. a console prompt or a fixed test answer. A
	 * decision that throws yields a failed stage.
	 */
	static ConfirmationChannel of(Predicate<String> decision) {
		Objects.requireNonNull(decision, "decision must not be null");
		return message -> {
			try {
				return CompletableFuture.completedFuture(decision.test(message));
			}
			catch (RuntimeException e) {
				return CompletableFuture.failedFuture(e);
			}
		};
	}

	/**
	 * Returns a channel whose answers fail with a {@link java.util.concurrent.TimeoutException}
	 * when the underlying channel has not answered within {@code timeout}.
	 */
	default ConfirmationChannel withTimeout(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		return message -> requestConfirmation(message)
				.toCompletableFuture()
				.thenApply(Function.identity())
				.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}
}
