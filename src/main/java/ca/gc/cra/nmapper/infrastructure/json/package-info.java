/**
 * Jackson mapping shared by the JDBC store, the command scanner and the CLI.
 */
package ca.gc.cra.nmapper.infrastructure.json;
