/**
 * Networks: creation, deletion, queries, and attachment to switch ports.
 */
package org.ndfcclient.network;
