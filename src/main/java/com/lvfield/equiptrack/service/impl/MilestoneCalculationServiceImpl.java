package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.dto.milestone.MilestoneGauge;
import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;
import com.lvfield.equiptrack.dto.milestone.PhaseRollup;
import com.lvfield.equiptrack.dto.milestone.StageCompletion;
import com.lvfield.equiptrack.exception.MilestoneCalculationException;
import com.lvfield.equiptrack.mapper.GlobalPartMapper;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.SiteProjectMapper;
import com.lvfield.equiptrack.model.GlobalPart;
import com.lvfield.equiptrack.model.MilestonePhase;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.SiteProject;
import com.lvfield.equiptrack.model.StageType;
import com.lvfield.equiptrack.service.InstallationRecordService;
import com.lvfield.equiptrack.service.MilestoneCalculationService;
import com.lvfield.equiptrack.util.MilestoneFormulas;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 里程碑计算实现
 * <p>
 * 1. 三路读库 (项目、设备+目录、点位阶段) 并发发出，每次调用只读一次；
 * 2. 8 个分项 + 2 个汇总互不依赖，全部并发计算后再汇总。
 */
@Slf4j
@Service
public class MilestoneCalculationServiceImpl implements MilestoneCalculationService {

    private final SiteProjectMapper siteProjectMapper;
    private final ProjectEquipmentMapper equipmentMapper;
    private final GlobalPartMapper globalPartMapper;
    private final InstallationRecordService installationRecordService;
    private final Executor executor;

    public MilestoneCalculationServiceImpl(SiteProjectMapper siteProjectMapper,
                                           ProjectEquipmentMapper equipmentMapper,
                                           GlobalPartMapper globalPartMapper,
                                           InstallationRecordService installationRecordService,
                                           @Qualifier("milestoneExecutor") Executor executor) {
        this.siteProjectMapper = siteProjectMapper;
        this.equipmentMapper = equipmentMapper;
        this.globalPartMapper = globalPartMapper;
        this.installationRecordService = installationRecordService;
        this.executor = executor;
    }

    @Override
    public MilestonePercentageBundle compute(Integer projectId) {
        try {
            return computeAsync(projectId).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof MilestoneCalculationException) {
                throw (MilestoneCalculationException) cause;
            }
            throw new MilestoneCalculationException(projectId, "里程碑计算失败: " + cause.getMessage(), cause);
        }
    }

    @Override
    public CompletableFuture<MilestonePercentageBundle> computeAsync(Integer projectId) {
        Objects.requireNonNull(projectId, "projectId");
        long start = System.currentTimeMillis();

        // 1. 并发读取输入数据
        CompletableFuture<SiteProject> projectFuture =
                CompletableFuture.supplyAsync(() -> siteProjectMapper.selectById(projectId), executor);
        CompletableFuture<List<ProjectEquipment>> equipmentFuture =
                CompletableFuture.supplyAsync(() -> loadEquipment(projectId), executor);
        CompletableFuture<Map<Integer, GlobalPart>> partsFuture =
                equipmentFuture.thenApplyAsync(this::loadParts, executor);
        CompletableFuture<StageCompletion> stagesFuture =
                CompletableFuture.supplyAsync(() -> installationRecordService.getStageCompletion(projectId), executor);

        return CompletableFuture.allOf(projectFuture, partsFuture, stagesFuture)
                .handle((ignored, ex) -> {
                    if (ex != null) {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        throw new MilestoneCalculationException(projectId,
                                "读取项目 [" + projectId + "] 进度数据失败: " + cause.getMessage(), cause);
                    }
                    return new MilestoneInput(projectFuture.join(), equipmentFuture.join(),
                            partsFuture.join(), stagesFuture.join());
                })
                // 2. 扇出计算
                .thenCompose(input -> fanOut(projectId, input))
                .whenComplete((bundle, ex) -> {
                    if (ex == null) {
                        log.debug("[里程碑] 项目 [{}] 计算完成，耗时 {} ms", projectId, System.currentTimeMillis() - start);
                    }
                });
    }

    private CompletableFuture<MilestonePercentageBundle> fanOut(Integer projectId, MilestoneInput input) {
        CompletableFuture<MilestoneGauge> planning = async(() -> MilestoneFormulas.planningPercentage(input.project));
        CompletableFuture<MilestoneGauge> prewireOrders = async(() -> ordersGauge(input, MilestonePhase.PREWIRE));
        CompletableFuture<MilestoneGauge> prewireReceiving = async(() -> receivingGauge(input, MilestonePhase.PREWIRE));
        CompletableFuture<MilestoneGauge> prewireStages = async(() -> stagesGauge(input, StageType.PREWIRE));
        CompletableFuture<MilestoneGauge> trimOrders = async(() -> ordersGauge(input, MilestonePhase.TRIM));
        CompletableFuture<MilestoneGauge> trimReceiving = async(() -> receivingGauge(input, MilestonePhase.TRIM));
        CompletableFuture<MilestoneGauge> trimStages = async(() -> stagesGauge(input, StageType.TRIM_OUT));
        CompletableFuture<MilestoneGauge> commissioning = async(() -> stagesGauge(input, StageType.COMMISSION));
        // 汇总自己算三个分项，不等上面的结果
        CompletableFuture<PhaseRollup> prewirePhase = async(() -> rollup(input, MilestonePhase.PREWIRE, StageType.PREWIRE));
        CompletableFuture<PhaseRollup> trimPhase = async(() -> rollup(input, MilestonePhase.TRIM, StageType.TRIM_OUT));

        return CompletableFuture.allOf(planning, prewireOrders, prewireReceiving, prewireStages,
                        trimOrders, trimReceiving, trimStages, commissioning, prewirePhase, trimPhase)
                .thenApply(v -> MilestonePercentageBundle.builder()
                        .projectId(projectId)
                        .planning(planning.join().getPercentage())
                        .prewireOrders(prewireOrders.join().getPercentage())
                        .prewireReceiving(prewireReceiving.join().getPercentage())
                        .prewireStages(prewireStages.join().getPercentage())
                        .trimOrders(trimOrders.join().getPercentage())
                        .trimReceiving(trimReceiving.join().getPercentage())
                        .trimStages(trimStages.join().getPercentage())
                        .commissioning(commissioning.join().getPercentage())
                        .prewirePhase(prewirePhase.join())
                        .trimPhase(trimPhase.join())
                        .build());
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private static MilestoneGauge ordersGauge(MilestoneInput input, MilestonePhase phase) {
        return MilestoneFormulas.ordersPercentage(input.eligible(phase));
    }

    private static MilestoneGauge receivingGauge(MilestoneInput input, MilestonePhase phase) {
        return MilestoneFormulas.receivingPercentage(input.eligible(phase));
    }

    private static MilestoneGauge stagesGauge(MilestoneInput input, StageType stage) {
        return MilestoneFormulas.stagesPercentage(input.stages.completed(stage), input.stages.getTotalDrops());
    }

    private static PhaseRollup rollup(MilestoneInput input, MilestonePhase phase, StageType stage) {
        return MilestoneFormulas.rollup(ordersGauge(input, phase), receivingGauge(input, phase), stagesGauge(input, stage));
    }

    private List<ProjectEquipment> loadEquipment(Integer projectId) {
        QueryWrapper<ProjectEquipment> query = new QueryWrapper<>();
        query.eq("project_id", projectId);
        return equipmentMapper.selectList(query);
    }

    private Map<Integer, GlobalPart> loadParts(List<ProjectEquipment> equipment) {
        Set<Integer> partIds = equipment.stream()
                .map(ProjectEquipment::getGlobalPartId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (partIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return globalPartMapper.selectBatchIds(partIds).stream()
                .collect(Collectors.toMap(GlobalPart::getId, Function.identity()));
    }

    /**
     * 一次计算的输入快照，所有分项共享、只读
     */
    private static final class MilestoneInput {

        private final SiteProject project;
        private final List<ProjectEquipment> equipment;
        private final Map<Integer, GlobalPart> parts;
        private final StageCompletion stages;

        private MilestoneInput(SiteProject project, List<ProjectEquipment> equipment,
                               Map<Integer, GlobalPart> parts, StageCompletion stages) {
            this.project = project;
            this.equipment = equipment == null ? Collections.emptyList() : List.copyOf(equipment);
            this.parts = parts;
            this.stages = stages == null ? StageCompletion.empty() : stages;
        }

        private List<ProjectEquipment> eligible(MilestonePhase phase) {
            return equipment.stream()
                    .filter(item -> phase.isEligible(item, parts.get(item.getGlobalPartId())))
                    .collect(Collectors.toList());
        }
    }
}
