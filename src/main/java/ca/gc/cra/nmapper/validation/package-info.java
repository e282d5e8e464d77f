/**
 * Input validation helpers shared by configuration loading, the CLI and scan target parsing.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emit no logs; failures raise {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.nmapper.validation;
