/**
 * Image management policies.
 */
package org.ndfcclient.imagepolicy;
