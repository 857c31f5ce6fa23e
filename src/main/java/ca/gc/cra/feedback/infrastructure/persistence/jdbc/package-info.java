/**
 * JDBC persistence for raw feedback rows and analytical rows.
 */
package ca.gc.cra.feedback.infrastructure.persistence.jdbc;
