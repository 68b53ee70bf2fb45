package com.delta.adfeed.monitor.extract;

import com.delta.adfeed.monitor.model.CandidateRecord;
import com.delta.adfeed.monitor.model.Target;

import java.util.List;

public interface AdExtractor {
    List<CandidateRecord> extract(String html, Target target, String currency);
}
