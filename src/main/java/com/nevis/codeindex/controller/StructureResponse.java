package com.nevis.codeindex.controller;

import com.nevis.codeindex.model.StructuralIndex;

import java.util.Map;

public record StructureResponse(
    Map<String, StructuralIndex.FileOutline> files,
    String rendered
) {}
