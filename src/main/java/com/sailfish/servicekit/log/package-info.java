/**
 * Logging façade over SLF4J.
 *
 * {@link com.sailfish.servicekit.log.LogBuilder} takes a
 * {@link com.sailfish.servicekit.log.LogConfiguration}, an optional custom
 * SLF4J logger and a level before producing an immutable
 * {@link com.sailfish.servicekit.log.Log}. Services depend on {@code Log}
 * only, so the logger underneath can be swapped without touching them.
 */
package com.sailfish.servicekit.log;
