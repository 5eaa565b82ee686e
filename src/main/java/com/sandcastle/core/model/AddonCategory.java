package com.sandcastle.core.model;

public enum AddonCategory {
    INTERFACE,
    COMPUTE,
    STORAGE,
    DEVOPS
}
