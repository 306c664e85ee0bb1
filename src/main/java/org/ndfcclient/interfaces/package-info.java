/**
 * Switch interface configuration.
 */
package org.ndfcclient.interfaces;
