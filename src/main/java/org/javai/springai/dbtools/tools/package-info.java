/**
 * LLM-facing tool surface over the execution gateway and schema inspector.
 * <p>
 * {@link org.javai.springai.dbtools.tools.DatabaseTools} is registered with Spring AI;
 * {@link org.javai.springai.dbtools.tools.DatabaseToolDispatcher} serves hosts that route
 * tool calls by name.
 */
package org.javai.springai.dbtools.tools;
