/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.operator;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.log4j.Log4j2;
import org.opensearch.exec.pipeline.DriverContext;
import org.opensearch.exec.plan.PlanNode;

/** Ordered set of {@link PlanNodeTranslator}s; the first one that answers wins. */
@Log4j2
public class PlanNodeTranslatorRegistry {

  private final List<PlanNodeTranslator> translators = new CopyOnWriteArrayList<>();

  /** Creates a registry holding every translator installed as a service on the classpath. */
  public static PlanNodeTranslatorRegistry loadInstalled() {
    PlanNodeTranslatorRegistry registry = new PlanNodeTranslatorRegistry();
    for (PlanNodeTranslator translator : ServiceLoader.load(PlanNodeTranslator.class)) {
      log.debug("Loaded plan node translator {}", translator.getClass().getName());
      registry.register(translator);
    }
    return registry;
  }

  public void register(PlanNodeTranslator translator) {
    translators.add(translator);
  }

  public List<PlanNodeTranslator> getTranslators() {
    return List.copyOf(translators);
  }

  /** Returns the operator made by the first translator handling the node. */
  public Optional<Operator> toOperator(
      DriverContext driverContext, int operatorId, PlanNode node) {
    for (PlanNodeTranslator translator : translators) {
      Operator operator = translator.toOperator(driverContext, operatorId, node);
      if (operator != null) {
        return Optional.of(operator);
      }
    }
    return Optional.empty();
  }

  /** Returns the parallelism cap the first answering translator declares for the node. */
  public OptionalInt maxDrivers(PlanNode node) {
    for (PlanNodeTranslator translator : translators) {
      OptionalInt result = translator.maxDrivers(node);
      if (result.isPresent()) {
        return result;
      }
    }
    return OptionalInt.empty();
  }
}
