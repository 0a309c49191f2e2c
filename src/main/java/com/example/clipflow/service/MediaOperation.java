package com.example.clipflow.service;

public enum MediaOperation {
    DOWNLOAD,
    MERGE,
    CONVERT,
    EXTRACT_AUDIO,
    DETECT_SEGMENTS,
    CUT
}
