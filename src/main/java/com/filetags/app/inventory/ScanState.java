package com.filetags.app.inventory;

public enum ScanState {
    IDLE,
    SCANNING
}
