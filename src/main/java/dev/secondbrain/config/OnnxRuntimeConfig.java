package dev.secondbrain.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment before the in-process embedding or cross-encoder model is
 * created.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once a
 * model has touched it, so the threading options are applied from a {@link
 * BeanFactoryPostProcessor}, ahead of any bean instantiation. Skipped entirely when neither ONNX
 * model is in use.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private Environment environment;

  @Override
  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    String provider =
        environment.getProperty("secondbrain.embedding.provider", "onnx").toLowerCase(Locale.ROOT);
    boolean rerankerEnabled =
        environment.getProperty("secondbrain.reranker.enabled", Boolean.class, true);
    if (!"onnx".equals(provider) && !rerankerEnabled) {
      log.debug("No ONNX model configured, leaving ONNX Runtime untouched");
      return;
    }
    int intraOpThreads =
        environment.getProperty("secondbrain.embedding.model-threads", Integer.class, 4);
    int interOpThreads = Math.max(1, intraOpThreads / 2);

    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "secondbrain", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    } catch (UnsatisfiedLinkError e) {
      log.warn(
          "ONNX Runtime native library unavailable, in-process models will fall back: {}",
          e.toString());
    }
  }
}
