package com.shoryokuka.domain.plan.service;

import com.shoryokuka.domain.plan.model.SectionId;

import java.util.Map;

/**
 * Renders finalized section texts into a document.
 */
public interface DocumentAssembler {

    String assemble(Map<SectionId, String> sections);
}
