/**
 * Advisory locks and leases.
 */
package turnstile.lock;
