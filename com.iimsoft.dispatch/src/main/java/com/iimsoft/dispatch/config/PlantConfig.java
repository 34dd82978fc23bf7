package com.iimsoft.dispatch.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 工厂静态配置：机型目录、操作工总数、每日工作分钟数、每周工作天数、产品路由表以及运行上限。
 * <p>
 * 运行期间不允许修改；调度前由 {@link com.iimsoft.dispatch.domain.ResourceCatalog#from(PlantConfig)}
 * 转成不可变的资源目录。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlantConfig {

    public static final int DEFAULT_MAX_ATTEMPTS_PER_ORDER = 30;
    public static final int DEFAULT_MAX_WORKING_DAYS = 0;

    @JsonProperty("machines")
    private List<MachineSpec> machines;

    @JsonProperty("totalOperatorsPool")
    private int totalOperatorsPool;

    @JsonProperty("dailyWorkMinutes")
    private int dailyWorkMinutes;

    @JsonProperty("workDaysPerWeek")
    private int workDaysPerWeek;

    /** 可选：Day 1 对应的日期（YYYY-MM-DD），只用于输出标签 */
    @JsonProperty("startDate")
    private String startDate;

    @JsonProperty("routes")
    private List<RouteSpec> routes;

    @JsonProperty("maxAttemptsPerOrder")
    private int maxAttemptsPerOrder = DEFAULT_MAX_ATTEMPTS_PER_ORDER;

    @JsonProperty("maxWorkingDays")
    private int maxWorkingDays = DEFAULT_MAX_WORKING_DAYS;

    public PlantConfig() {
        this.machines = new ArrayList<>();
        this.routes = new ArrayList<>();
    }

    /**
     * 默认工厂：3 种成型机、2 台折弯机，剪板和叉车只是工序角色（units=0）；
     * 10 名操作工，每天 8 小时，每周 5 个工作日。
     */
    public static PlantConfig defaultPlant() {
        PlantConfig cfg = new PlantConfig();
        cfg.machines.add(MachineSpec.forming("Yane600", 16, 11, 2, 1));
        cfg.machines.add(MachineSpec.forming("Yane672", 20, 16.5, 1, 1));
        cfg.machines.add(MachineSpec.forming("Yane750", 20, 9.5, 1, 1));
        cfg.machines.add(MachineSpec.bending("Bending", 4, 9.7, 2, 2));
        cfg.machines.add(MachineSpec.role("Shearing", 2));
        cfg.machines.add(MachineSpec.role("Forklift", 1));
        cfg.totalOperatorsPool = 10;
        cfg.dailyWorkMinutes = 8 * 60;
        cfg.workDaysPerWeek = 5;

        // SD680 / Kabe325 没有专用机，借用 Yane750 的产能
        cfg.routes.add(RouteSpec.forming("Yane600", "Yane600"));
        cfg.routes.add(RouteSpec.forming("Yane672", "Yane672"));
        cfg.routes.add(RouteSpec.forming("Yane750", "Yane750"));
        cfg.routes.add(RouteSpec.forming("SD680", "Yane750"));
        cfg.routes.add(RouteSpec.forming("Kabe325", "Yane750"));
        cfg.routes.add(RouteSpec.shearingBending("Aksesoris", "Bending", "Shearing", "Forklift"));
        return cfg;
    }

    public List<MachineSpec> getMachines() {
        return machines;
    }

    public void setMachines(List<MachineSpec> machines) {
        this.machines = machines;
    }

    public int getTotalOperatorsPool() {
        return totalOperatorsPool;
    }

    public void setTotalOperatorsPool(int totalOperatorsPool) {
        this.totalOperatorsPool = totalOperatorsPool;
    }

    public int getDailyWorkMinutes() {
        return dailyWorkMinutes;
    }

    public void setDailyWorkMinutes(int dailyWorkMinutes) {
        this.dailyWorkMinutes = dailyWorkMinutes;
    }

    public int getWorkDaysPerWeek() {
        return workDaysPerWeek;
    }

    public void setWorkDaysPerWeek(int workDaysPerWeek) {
        this.workDaysPerWeek = workDaysPerWeek;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public List<RouteSpec> getRoutes() {
        return routes;
    }

    public void setRoutes(List<RouteSpec> routes) {
        this.routes = routes;
    }

    public int getMaxAttemptsPerOrder() {
        return maxAttemptsPerOrder;
    }

    public void setMaxAttemptsPerOrder(int maxAttemptsPerOrder) {
        this.maxAttemptsPerOrder = maxAttemptsPerOrder;
    }

    public int getMaxWorkingDays() {
        return maxWorkingDays;
    }

    public void setMaxWorkingDays(int maxWorkingDays) {
        this.maxWorkingDays = maxWorkingDays;
    }

    /**
     * 机型条目。speedMPerMin 与 secondsPerBend 二选一；units=0 表示只占操作工、不占机时的工序角色。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineSpec {
        @JsonProperty("id")
        private String id;

        @JsonProperty("speedMPerMin")
        private Double speedMPerMin;

        @JsonProperty("secondsPerBend")
        private Double secondsPerBend;

        @JsonProperty("powerKw")
        private double powerKw;

        @JsonProperty("units")
        private int units;

        @JsonProperty("operatorsNeeded")
        private int operatorsNeeded;

        public MachineSpec() {
        }

        public static MachineSpec forming(String id, double speedMPerMin, double powerKw, int units, int operatorsNeeded) {
            MachineSpec m = new MachineSpec();
            m.id = id;
            m.speedMPerMin = speedMPerMin;
            m.powerKw = powerKw;
            m.units = units;
            m.operatorsNeeded = operatorsNeeded;
            return m;
        }

        public static MachineSpec bending(String id, double secondsPerBend, double powerKw, int units, int operatorsNeeded) {
            MachineSpec m = new MachineSpec();
            m.id = id;
            m.secondsPerBend = secondsPerBend;
            m.powerKw = powerKw;
            m.units = units;
            m.operatorsNeeded = operatorsNeeded;
            return m;
        }

        public static MachineSpec role(String id, int operatorsNeeded) {
            MachineSpec m = new MachineSpec();
            m.id = id;
            m.units = 0;
            m.operatorsNeeded = operatorsNeeded;
            return m;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Double getSpeedMPerMin() {
            return speedMPerMin;
        }

        public void setSpeedMPerMin(Double speedMPerMin) {
            this.speedMPerMin = speedMPerMin;
        }

        public Double getSecondsPerBend() {
            return secondsPerBend;
        }

        public void setSecondsPerBend(Double secondsPerBend) {
            this.secondsPerBend = secondsPerBend;
        }

        public double getPowerKw() {
            return powerKw;
        }

        public void setPowerKw(double powerKw) {
            this.powerKw = powerKw;
        }

        public int getUnits() {
            return units;
        }

        public void setUnits(int units) {
            this.units = units;
        }

        public int getOperatorsNeeded() {
            return operatorsNeeded;
        }

        public void setOperatorsNeeded(int operatorsNeeded) {
            this.operatorsNeeded = operatorsNeeded;
        }
    }

    /**
     * 产品类型 -> 机型 的路由条目。workflow 取值 FORMING / SHEARING_BENDING。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RouteSpec {
        @JsonProperty("productType")
        private String productType;

        @JsonProperty("workflow")
        private String workflow;

        @JsonProperty("machineType")
        private String machineType;

        /** 只占操作工的协作角色（例如剪板、叉车） */
        @JsonProperty("supportRoles")
        private List<String> supportRoles;

        public RouteSpec() {
            this.supportRoles = new ArrayList<>();
        }

        public static RouteSpec forming(String productType, String machineType) {
            RouteSpec r = new RouteSpec();
            r.productType = productType;
            r.workflow = "FORMING";
            r.machineType = machineType;
            return r;
        }

        public static RouteSpec shearingBending(String productType, String machineType, String... supportRoles) {
            RouteSpec r = new RouteSpec();
            r.productType = productType;
            r.workflow = "SHEARING_BENDING";
            r.machineType = machineType;
            r.supportRoles = new ArrayList<>(List.of(supportRoles));
            return r;
        }

        public String getProductType() {
            return productType;
        }

        public void setProductType(String productType) {
            this.productType = productType;
        }

        public String getWorkflow() {
            return workflow;
        }

        public void setWorkflow(String workflow) {
            this.workflow = workflow;
        }

        public String getMachineType() {
            return machineType;
        }

        public void setMachineType(String machineType) {
            this.machineType = machineType;
        }

        public List<String> getSupportRoles() {
            return supportRoles;
        }

        public void setSupportRoles(List<String> supportRoles) {
            this.supportRoles = supportRoles;
        }
    }
}
