package com.nevis.codeindex.event;

import com.nevis.codeindex.model.TaskStatusView;

public record TaskProgressEvent(TaskStatusView status) {}
