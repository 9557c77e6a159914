package com.pharmacy.fraud.scoring;

import com.pharmacy.fraud.model.RunWarning;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;

@Value
public class AggregationOutcome {
    SortedMap<String, PartialAggregate> partials;   // keyed by entity id
    List<RunWarning> warnings;
}
