/**
 * Connector contract and the value and failure types shared by every part of the
 * database tools.
 * <p>
 * Implement {@link org.javai.springai.dbtools.api.DatabaseConnector} (or extend
 * {@link org.javai.springai.dbtools.api.AbstractDatabaseConnector}) to make a database
 * reachable; failures surface as {@link org.javai.springai.dbtools.api.DatabaseToolException}
 * with an {@link org.javai.springai.dbtools.api.ErrorKind}.
 */
package org.javai.springai.dbtools.api;
