/**
 * Internal helpers: thread naming, JSON payload codec and SQL error translation.
 */
package io.recordstore.util;
