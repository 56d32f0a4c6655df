package com.flavorsnap.backend.category.model;

public enum VoteOutcome {
    /** 第一次投 */
    RECORDED,
    /** 改投另一邊 */
    CHANGED,
    /** 同一個人重送同一票 */
    UNCHANGED
}
