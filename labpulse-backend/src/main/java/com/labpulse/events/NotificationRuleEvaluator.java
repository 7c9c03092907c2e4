package com.labpulse.events;

import com.labpulse.model.MetricPayload;
import com.labpulse.model.NotificationRule;
import com.labpulse.model.ThresholdOperator;
import com.labpulse.notification.Notification;
import com.labpulse.notification.Notifier;
import com.labpulse.persistence.NotificationRuleRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bus subscriber checking each payload against the integration's threshold rules.
 *
 * <p>A rule fires when its metric is present, numeric and satisfies the comparison. After firing, the
 * rule stays quiet for its cooldown, whether or not the notifier succeeded. Cooldowns live in memory
 * and reset on restart.
 */
@Component
public class NotificationRuleEvaluator implements MetricsListener {
    private static final Logger log = LoggerFactory.getLogger(NotificationRuleEvaluator.class);

    static final int DEFAULT_COOLDOWN_MINUTES = 30;

    private final MetricsEventBus eventBus;
    private final NotificationRuleRepository ruleRepository;
    private final Notifier notifier;
    private final Clock clock;
    private final Map<Long, Instant> cooldownUntil = new ConcurrentHashMap<>();
    private Subscription subscription;

    public NotificationRuleEvaluator(
            MetricsEventBus eventBus,
            NotificationRuleRepository ruleRepository,
            Notifier notifier,
            Clock clock
    ) {
        this.eventBus = eventBus;
        this.ruleRepository = ruleRepository;
        this.notifier = notifier;
        this.clock = clock;
    }

    @PostConstruct
    public void subscribe() {
        subscription = eventBus.subscribe(this);
        log.info("Notification rule evaluator subscribed to metrics");
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    @Override
    public void onMetrics(MetricPayload payload) {
        if (payload == null || payload.getData() == null) {
            return;
        }
        List<NotificationRule> rules;
        try {
            rules = ruleRepository.listActiveRules(payload.getIntegrationId());
        } catch (RuntimeException e) {
            log.error("Failed to load notification rules: integration_id={}", payload.getIntegrationId(), e);
            return;
        }
        if (rules.isEmpty()) {
            return;
        }

        log.debug("Evaluating notification rules: integration_id={}, rules={}", payload.getIntegrationId(), rules.size());
        for (NotificationRule rule : rules) {
            evaluate(rule, payload);
        }
    }

    /**
     * @param ruleId rule id
     * @return true while the rule is muted after firing
     */
    public boolean isInCooldown(long ruleId) {
        Instant until = cooldownUntil.get(ruleId);
        if (until == null) {
            return false;
        }
        if (!clock.instant().isBefore(until)) {
            cooldownUntil.remove(ruleId, until);
            return false;
        }
        return true;
    }

    private void evaluate(NotificationRule rule, MetricPayload payload) {
        Object raw = payload.getData().get(rule.getMetricKey());
        if (raw == null) {
            return;
        }

        Optional<Double> value = toNumber(raw);
        if (value.isEmpty()) {
            log.warn("Non-numeric value for rule metric: rule_id={}, key={}, value={}", rule.getId(), rule.getMetricKey(), raw);
            return;
        }

        Optional<ThresholdOperator> operator = ThresholdOperator.fromTag(rule.getOperator());
        if (operator.isEmpty()) {
            log.warn("Unknown rule operator: rule_id={}, operator={}", rule.getId(), rule.getOperator());
            return;
        }

        double metricValue = value.get();
        if (!operator.get().test(metricValue, rule.getThreshold())) {
            return;
        }
        if (isInCooldown(rule.getId())) {
            log.debug("Rule in cooldown, skipping: rule_id={}, name={}", rule.getId(), rule.getName());
            return;
        }

        log.info("Rule triggered: rule_id={}, name={}, {} {} {}", rule.getId(), rule.getName(),
                rule.getMetricKey(), operator.get().symbol(), format(rule.getThreshold()));
        try {
            notifier.send(toNotification(rule, operator.get(), payload, metricValue));
        } catch (RuntimeException e) {
            log.error("Failed to send notification: rule_id={}, name={}", rule.getId(), rule.getName(), e);
        }
        cooldownUntil.put(rule.getId(), clock.instant().plus(cooldown(rule)));
    }

    private static Notification toNotification(NotificationRule rule, ThresholdOperator operator,
                                               MetricPayload payload, double metricValue) {
        String message = String.format("%s: %s is %s (%s %s)", payload.getIntegrationName(), rule.getMetricKey(),
                format(metricValue), operator.symbol(), format(rule.getThreshold()));
        return Notification.builder()
                .ruleId(rule.getId())
                .title(rule.getName())
                .message(message)
                .severity(rule.getSeverity() != null ? rule.getSeverity() : "warning")
                .integrationId(payload.getIntegrationId())
                .integrationName(payload.getIntegrationName())
                .integrationType(payload.getIntegrationType())
                .metricKey(rule.getMetricKey())
                .metricValue(metricValue)
                .threshold(rule.getThreshold())
                .operator(operator.tag())
                .build();
    }

    private static Duration cooldown(NotificationRule rule) {
        Integer minutes = rule.getCooldownMinutes();
        return Duration.ofMinutes(minutes != null && minutes > 0 ? minutes : DEFAULT_COOLDOWN_MINUTES);
    }

    static Optional<Double> toNumber(Object raw) {
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
        }
        if (raw instanceof String text) {
            try {
                double d = Double.parseDouble(text.trim());
                return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
