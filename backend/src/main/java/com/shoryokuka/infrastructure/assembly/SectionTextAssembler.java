package com.shoryokuka.infrastructure.assembly;

import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.service.DocumentAssembler;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Plain-text rendering of the finalized sections, one heading per section.
 * The Word/Excel rendering lives outside this service.
 */
@Component
public class SectionTextAssembler implements DocumentAssembler {

    static final String SECTION_SEPARATOR = "\n\n\n";

    @Override
    public String assemble(Map<SectionId, String> sections) {
        StringJoiner document = new StringJoiner(SECTION_SEPARATOR);
        sections.forEach((id, text) -> document.add(heading(id) + "\n" + text));
        return document.toString();
    }

    static String heading(SectionId id) {
        return "【" + id.code() + " " + id.title() + "】";
    }
}
