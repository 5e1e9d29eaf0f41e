package org.javai.springai.dbtools.exec;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.javai.springai.dbtools.api.ConfirmationChannel;
import org.javai.springai.dbtools.api.DatabaseConnector;
import org.javai.springai.dbtools.api.DatabaseToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate applied to mutating statements before they reach a connector.
 *
 * <p>The connector's {@link DatabaseConnector#allowWrites()} flag decides whether a
 * write is possible at all. When it is, and a {@link ConfirmationChannel} is present,
 * the user is asked to approve the statement; without a channel the flag alone is
 * enough.</p>
 */
public final class WriteAuthorizer {

	private static final Logger logger = LoggerFactory.getLogger(WriteAuthorizer.class);

	private final ConfirmationChannel confirmationChannel;

	private WriteAuthorizer(ConfirmationChannel confirmationChannel) {
		this.confirmationChannel = confirmationChannel;
	}

	/**
	 * Authorizer that relies on the connector flag only.
	 */
	public static WriteAuthorizer flagOnly() {
		return new WriteAuthorizer(null);
	}

	/**
	 * Authorizer that also asks for confirmation of every permitted write.
	 */
	public static WriteAuthorizer withConfirmation(ConfirmationChannel channel) {
		return new WriteAuthorizer(Objects.requireNonNull(channel, "channel must not be null"));
	}

	public Optional<ConfirmationChannel> confirmationChannel() {
		return Optional.ofNullable(confirmationChannel);
	}

	/**
	 * Returns normally when {@code sql} may run as a write against {@code connector}.
	 *
	 * @throws DatabaseToolException {@code WRITE_NOT_PERMITTED} when the connector is read-only,
	 * {@code USER_REJECTED} when confirmation was declined or never arrived
	 */
	public void authorize(String resourceName, DatabaseConnector connector, String sql) {
		if (!connector.allowWrites()) {
			logger.warn("Refused write on read-only database '{}'", resourceName);
			throw DatabaseToolException.writeNotPermitted(resourceName);
		}
		if (confirmationChannel == null) {
			return;
		}
		if (!awaitConfirmation(resourceName, confirmationMessage(resourceName, sql))) {
			logger.warn("User rejected write on database '{}'", resourceName);
			throw DatabaseToolException.userRejected(resourceName);
		}
	}

	static String confirmationMessage(String resourceName, String sql) {
		return "Execute SQL write operation on database '%s'?\n\nQuery: %s".formatted(resourceName, sql);
	}

	private boolean awaitConfirmation(String resourceName, String message) {
		CompletableFuture<Boolean> pending = request(resourceName, message);
		try {
			return Boolean.TRUE.equals(pending.get());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw DatabaseToolException.userRejected(resourceName, e);
		}
		catch (ExecutionException e) {
			logger.warn("Confirmation for database '{}' failed: {}", resourceName, e.getCause().toString());
			throw DatabaseToolException.userRejected(resourceName, e.getCause());
		}
		catch (CancellationException e) {
			throw DatabaseToolException.userRejected(resourceName, e);
		}
	}

	// A channel that throws or hands back no stage has not approved anything.
	private CompletableFuture<Boolean> request(String resourceName, String message) {
		try {
			CompletionStage<Boolean> stage = confirmationChannel.requestConfirmation(message);
			if (stage == null) {
				throw new IllegalStateException("Confirmation channel returned no answer");
			}
			return stage.toCompletableFuture();
		}
		catch (RuntimeException e) {
			logger.warn("Confirmation for database '{}' failed: {}", resourceName, e.toString());
			throw DatabaseToolException.userRejected(resourceName, e);
		}
	}
}
