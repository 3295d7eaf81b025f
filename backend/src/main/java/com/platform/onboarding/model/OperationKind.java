package com.platform.onboarding.model;

public enum OperationKind {
    CREATE,
    MODIFY,
    DELETE
}
