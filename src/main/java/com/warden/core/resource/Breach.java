package com.warden.core.resource;

import com.warden.core.model.ExitClassification;

/**
 * First resource ceiling broken by an execution.
 */
public record Breach(ExitClassification classification, String detail) {}
