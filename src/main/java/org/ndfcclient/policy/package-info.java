/**
 * Switch policies.
 */
package org.ndfcclient.policy;
