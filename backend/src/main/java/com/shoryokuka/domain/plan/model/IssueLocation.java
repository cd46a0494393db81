package com.shoryokuka.domain.plan.model;

/**
 * Where an issue was found.
 *
 * @param sectionId section of the text
 * @param slotIndex slot (paragraph) index, -1 when the issue spans the whole section
 * @param start     start offset inside the slot text, -1 when not applicable
 * @param end       end offset (exclusive), -1 when not applicable
 */
public record IssueLocation(SectionId sectionId, int slotIndex, int start, int end) {

    public static IssueLocation section(SectionId sectionId) {
        return new IssueLocation(sectionId, -1, -1, -1);
    }

    public static IssueLocation slot(SectionId sectionId, int slotIndex) {
        return new IssueLocation(sectionId, slotIndex, -1, -1);
    }

    public boolean isSlotLevel() {
        return slotIndex >= 0;
    }
}
