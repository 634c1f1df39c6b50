package com.testconductor.interrupt;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers all {@link PopupRule} implementations and holds them in priority order.
 *
 * At construction time the registry:
 *   1. Scans {@code com.testconductor.interrupt.rules} with Reflections
 *   2. Finds every class annotated with {@link ClassifiesPopup}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Sorts by priority ascending
 *
 * Duplicate ids and annotated classes that do not implement {@link PopupRule}
 * fail construction with an {@link IllegalStateException}.
 */
public class PopupRuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(PopupRuleRegistry.class);
    private static final String RULES_PACKAGE = "com.testconductor.interrupt.rules";

    private final List<PopupRule> rules;

    public PopupRuleRegistry() {
        this.rules = Collections.unmodifiableList(discoverAndSort());
        log.info("PopupRuleRegistry: {} rule(s) registered in priority order: {}",
            rules.size(), ruleIds());
    }

    /** All rules, lowest priority number first. */
    public List<PopupRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    /** Rule ids in evaluation order. */
    public List<String> ruleIds() {
        return rules.stream()
            .map(r -> r.getClass().getAnnotation(ClassifiesPopup.class).id())
            .toList();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private List<PopupRule> discoverAndSort() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(RULES_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(ClassifiesPopup.class);

        List<PopupRule> discovered = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (Class<?> cls : annotated) {
            ClassifiesPopup annotation = cls.getAnnotation(ClassifiesPopup.class);
            String id = annotation.id();

            if (!PopupRule.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @ClassifiesPopup(id=\"" + id +
                    "\") but does not implement PopupRule");
            }
            if (!seenIds.add(id)) {
                throw new IllegalStateException(
                    "Duplicate popup rule id \"" + id + "\" found in " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);  // rules are package-private
                discovered.add((PopupRule) constructor.newInstance());
                log.debug("PopupRuleRegistry: registered '{}' (priority={}) -> {}",
                    id, annotation.priority(), cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate popup rule " + cls.getName() + ".", e);
            }
        }

        discovered.sort(Comparator.comparingInt(
            r -> r.getClass().getAnnotation(ClassifiesPopup.class).priority()));
        return discovered;
    }
}
