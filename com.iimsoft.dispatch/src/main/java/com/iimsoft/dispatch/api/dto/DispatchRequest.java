package com.iimsoft.dispatch.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.iimsoft.dispatch.config.PlantConfig;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DispatchRequest {

    /** 可选：不填则用 PlantConfigLoader 的配置 */
    public PlantConfig plant;

    public List<OrderDto> orders;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrderDto {
        public String orderId;
        public String productType;   // Yane600/Yane672/Yane750/SD680/Kabe325/Aksesoris
        public String priority;      // URGENT/NORMAL（也接受 Mendesak/Normal）
        public String thicknessBmt;  // 例如 0.5mm，只做展示

        /** 成型类产品：总长度（米） */
        public Double totalLengthM;

        /** 配件：每件折弯数、件数 */
        public Integer bendsPerItem;
        public Integer itemCount;
    }
}
