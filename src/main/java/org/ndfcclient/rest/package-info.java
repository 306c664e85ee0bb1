/**
 * Request and reply plumbing shared by every controller operation.
 *
 * <p>{@link org.ndfcclient.rest.Sender} authenticates and sends single requests,
 * {@link org.ndfcclient.rest.ResponseHandler} turns replies into success, found and changed
 * flags, {@link org.ndfcclient.rest.RestSend} retries unsuccessful requests until a timeout
 * expires, and {@link org.ndfcclient.rest.Results} collects what a command changed.
 */
package org.ndfcclient.rest;
