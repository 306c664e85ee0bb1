/**
 * Switch reachability, discovery and device lookup.
 */
package org.ndfcclient.discover;
