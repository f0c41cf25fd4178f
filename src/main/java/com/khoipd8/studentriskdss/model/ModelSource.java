package com.khoipd8.studentriskdss.model;

public enum ModelSource {
    TRAINED,
    LOADED,
    ABSENT
}
