package com.invoice.chargemap.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationBatchResult {

    private long snapshotVersion;                    // rule tables the whole batch ran against
    private List<ClassifiedLineItem> items = new ArrayList<>();
    private ClassificationReport report;
}
