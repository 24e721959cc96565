package com.codifier.domain.apply.model;

import com.codifier.domain.act.model.Act;

public record ApplyResult(Act newAct, ReversePatch reversePatch, ApplyManifest manifest) {}
