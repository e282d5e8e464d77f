/**
 * JDBC snapshot store and its versioned schema scripts ({@code /db/migration}).
 */
package ca.gc.cra.nmapper.infrastructure.persistence.jdbc;
