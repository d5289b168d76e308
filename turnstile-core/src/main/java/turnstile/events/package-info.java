/**
 * Per-build append-only event log with live tailing.
 *
 * <p>Sequence numbers come from a counter row that every appender of a build updates, so
 * concurrent appends serialize there and numbering has no gaps. Finishing a build writes
 * its terminal event and removes the counter in one transaction; readers treat a missing
 * counter as "no more events will come".
 */
package turnstile.events;
