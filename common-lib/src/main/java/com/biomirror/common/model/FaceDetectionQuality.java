package com.biomirror.common.model;

/** Quality of the face detection reported with each facial sample, worst first. */
public enum FaceDetectionQuality {
    NO_FACE,
    POOR,
    FAIR,
    GOOD,
    EXCELLENT
}
