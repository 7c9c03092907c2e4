package com.labpulse.persistence;

import com.labpulse.model.CardStatusMapping;

import java.util.List;

/**
 * Cards that display a status indicator.
 */
public interface CardStatusMappingRepository {

    /**
     * @return every card with status display enabled, mapped or not, ordered by id
     */
    List<CardStatusMapping> listStatusCards();
}
