package org.javai.springai.dbtools.prompt;

import java.util.Optional;

/**
 * Contributes dynamic context to the system prompt.
 *
 * <p>Implementations describe capabilities the model can use, such as the databases
 * reachable through the database tools.</p>
 */
public interface PromptContributor {

	/**
	 * Render an optional prompt contribution.
	 *
	 * @param context prompt context supplied by the host (may be null)
	 * @return text to include in system prompt, or empty if nothing to add
	 */
	Optional<String> contribute(PromptContext context);
}
