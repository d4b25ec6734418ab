/**
 * Client facade for AWS MemoryDB and other Redis/Valkey compatible stores.
 *
 * <p>{@link org.memorydb.client.MemoryDbClient} is the entry point; the Lettuce backed implementation lives in
 * {@code org.memorydb.client.connection}.</p>
 */
package org.memorydb.client;
