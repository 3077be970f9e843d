package com.bit.hydro.exception;

public enum ErrorType {
    UNAUTHORIZED("无权限（调用方不是管理员或锁仓所有者）"),
    VALIDATION("参数校验失败"),
    NOT_FOUND("数据不存在"),
    ARITHMETIC("数值运算溢出"),
    STORAGE("存储读写失败"),
    SNAPSHOT_UNAVAILABLE("快照高度早于快照启用高度"),
    LINEAGE_CORRUPTED("锁仓拆分/合并关系异常"),
    PAUSED("合约已暂停");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
