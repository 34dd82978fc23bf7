package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.config.PlantConfig;
import com.iimsoft.dispatch.domain.Workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 产品类型 -> 工艺流程 + 机型 的路由表。
 * <p>
 * 这是显式的排产策略：派生产品（例如 SD680、Kabe325）没有专用机，路由到某台成型机上，
 * 共享那台机器的产能。表里没有的产品类型视为无法识别。
 */
public class ProductRouting {

    /**
     * 一条路由。supportRoleIds 只消耗操作工名额，不占机时。
     */
    public static final class Route {
        private final String productType;
        private final Workflow workflow;
        private final String machineTypeId;
        private final List<String> supportRoleIds;

        public Route(String productType, Workflow workflow, String machineTypeId, List<String> supportRoleIds) {
            this.productType = productType;
            this.workflow = workflow;
            this.machineTypeId = machineTypeId;
            this.supportRoleIds = supportRoleIds == null ? List.of() : List.copyOf(supportRoleIds);
        }

        public String getProductType() { return productType; }
        public Workflow getWorkflow() { return workflow; }
        public String getMachineTypeId() { return machineTypeId; }
        public List<String> getSupportRoleIds() { return supportRoleIds; }

        @Override
        public String toString() {
            return productType + " -> " + workflow + "@" + machineTypeId
                    + (supportRoleIds.isEmpty() ? "" : " + " + supportRoleIds);
        }
    }

    private final Map<String, Route> routesByProductType;

    public ProductRouting(List<Route> routes) {
        Map<String, Route> map = new LinkedHashMap<>();
        for (Route r : routes) {
            if (map.put(r.getProductType(), r) != null) {
                throw new IllegalArgumentException("Duplicate route for product type: " + r.getProductType());
            }
        }
        this.routesByProductType = Collections.unmodifiableMap(map);
    }

    public static ProductRouting from(PlantConfig cfg) {
        if (cfg.getRoutes() == null || cfg.getRoutes().isEmpty()) {
            throw new IllegalArgumentException("plant.routes 不能为空");
        }
        List<Route> routes = new ArrayList<>();
        for (PlantConfig.RouteSpec r : cfg.getRoutes()) {
            if (r.getProductType() == null || r.getProductType().isBlank()) {
                throw new IllegalArgumentException("route.productType 不能为空");
            }
            if (r.getMachineType() == null || r.getMachineType().isBlank()) {
                throw new IllegalArgumentException("route.machineType 不能为空: " + r.getProductType());
            }
            Workflow workflow;
            try {
                workflow = Workflow.valueOf(r.getWorkflow() == null ? "" : r.getWorkflow().trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown workflow '" + r.getWorkflow() + "' for product type " + r.getProductType(), e);
            }
            routes.add(new Route(r.getProductType(), workflow, r.getMachineType(), r.getSupportRoles()));
        }
        return new ProductRouting(routes);
    }

    public Optional<Route> resolve(String productType) {
        if (productType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(routesByProductType.get(productType.trim()));
    }

    public Set<String> getProductTypes() {
        return routesByProductType.keySet();
    }
}
