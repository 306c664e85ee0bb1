/**
 * Fabrics: queries, creation and deletion, switch inventory, and configuration deployment.
 */
package org.ndfcclient.fabric;
