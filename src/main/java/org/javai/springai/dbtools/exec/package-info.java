/**
 * Statement execution: classification, the write gate and connector invocation.
 */
package org.javai.springai.dbtools.exec;
