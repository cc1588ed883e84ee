package com.solapi.sdk.messages;

/**
 * Message kinds understood by the SOLAPI send API.
 */
public enum MessageType {
    SMS,
    LMS,
    MMS,
    ATA,
    CTA,
    CTI,
    RCS_SMS,
    RCS_LMS,
    RCS_MMS,
    RCS_TPL,
    VOICE,
    FAX
}
