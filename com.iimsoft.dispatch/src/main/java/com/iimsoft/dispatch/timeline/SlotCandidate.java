package com.iimsoft.dispatch.timeline;

import com.iimsoft.dispatch.domain.MachineUnit;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 空档搜索结果：某台机器当天可用的 [start, end)。
 */
@Data
@AllArgsConstructor
public class SlotCandidate {
    MachineUnit unit;
    double start;
    double end;
}
