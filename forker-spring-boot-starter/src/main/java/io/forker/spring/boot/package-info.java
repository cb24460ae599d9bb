/**
 * Spring Boot auto-configuration for the dispatcher.
 *
 * <p>{@link io.forker.spring.boot.ForkerAutoConfiguration} creates a
 * {@link io.forker.Forker} bound to {@code forker.*} properties, and
 * {@link io.forker.spring.boot.ForkerMicrometerAutoConfiguration} exports its metrics to
 * Micrometer when a {@code MeterRegistry} is available.
 *
 * @see io.forker.spring.boot.ForkerProperties
 */
package io.forker.spring.boot;
