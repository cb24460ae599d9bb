/**
 * Threading helpers shared by the dispatcher and its integrations.
 */
package io.forker.util;
