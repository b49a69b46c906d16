package com.toolstock.notifier.transport;

/** Connection state as reported by the transport itself (not our session state machine). */
public enum TransportState {
    CONNECTED,
    CONNECTING,
    /** The linked device must be paired again (QR scan). */
    PAIRING_REQUIRED,
    DISCONNECTED,
    UNKNOWN
}
