package io.forker.spring.boot;

import io.forker.AllCompleteListener;
import io.forker.Forker;
import io.forker.ItemCompleteListener;
import io.forker.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the dispatcher.
 *
 * <p>Creates a context-owned {@link ForkerWorkerPool} and a {@link Forker} bound to
 * {@link ForkerProperties}. Every {@link ItemCompleteListener} and
 * {@link AllCompleteListener} bean is registered on the dispatcher in {@code @Order}
 * order, and a {@link MetricsExporter} bean is used when one exists.
 *
 * @see ForkerProperties
 * @see ForkerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Forker.class)
@EnableConfigurationProperties(ForkerProperties.class)
public class ForkerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ForkerWorkerPool forkerWorkerPool(ForkerProperties props) {
    return new ForkerWorkerPool(
        props.getWorker().getThreadNamePrefix(), props.getWorker().getShutdownTimeoutMs());
  }

  @Bean
  @ConditionalOnMissingBean
  public Forker forker(ForkerProperties props,
      ForkerWorkerPool workerPool,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ItemCompleteListener> itemListeners,
      ObjectProvider<AllCompleteListener> allListeners) {

    Forker forker = Forker.builder()
        .maxAllowed(props.getMaxAllowed())
        .executor(workerPool)
        .metrics(metricsProvider.getIfAvailable())
        .build();
    itemListeners.orderedStream().forEach(forker::onItemComplete);
    allListeners.orderedStream().forEach(forker::onAllComplete);
    return forker;
  }
}
