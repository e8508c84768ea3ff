package com.plogic.spring;

import com.plogic.adapter.spring.LogicAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers a shared {@link com.plogic.PropositionEngine} configured from
 * {@code plogic.config-path}, for applications that do not rely on auto-configuration.
 * <p>
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableLogic
 * public class RulesApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(RulesApplication.class, args);
 *     }
 * }
 *
 * &#64;Service
 * public class RuleService {
 *     private final PropositionEngine engine;
 *
 *     public RuleService(PropositionEngine engine) {
 *         this.engine = engine;
 *     }
 *
 *     public boolean holds(String rule, Map&lt;String, Boolean&gt; facts) {
 *         return engine.evaluate(rule, facts);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(LogicAutoConfiguration.class)
public @interface EnableLogic {
}
