package com.minimember.domain.enums;

public enum MemberRefType {
    USER,
    CONVERSATION
}
