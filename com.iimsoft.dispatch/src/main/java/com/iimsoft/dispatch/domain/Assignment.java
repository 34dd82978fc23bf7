package com.iimsoft.dispatch.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 订单落位结果：哪台机器、哪一天、从第几分钟到第几分钟（相对当天工作开始）。
 */
@Data
@AllArgsConstructor
public class Assignment {
    private MachineUnit unit;
    private int day;
    private double startMinute;
    private double endMinute;
    private double durationMinutes;
    private int operatorsUsed;
    private double energyKwh;
}
