package com.deliveryhealth.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Narrative {
    public final String headline;
    public final String text;
    public final List<String> clauses;
    public final String topDetractor;
    public final double topDetractorGap;
    public final String topPerformer;
}
