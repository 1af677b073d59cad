package com.eainde.atlas.run;

public enum NodeStatus {
    SUCCESS,
    ERROR
}
