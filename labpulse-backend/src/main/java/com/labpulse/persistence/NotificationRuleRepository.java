package com.labpulse.persistence;

import com.labpulse.model.NotificationRule;

import java.util.List;

/**
 * Read access to threshold notification rules.
 */
public interface NotificationRuleRepository {

    /**
     * @param integrationId integration id
     * @return active rules targeting the integration, ordered by id
     */
    List<NotificationRule> listActiveRules(long integrationId);
}
