package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lvfield.equiptrack.dto.reconcile.LinkRestoreFailure;
import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ReconciliationReport;
import com.lvfield.equiptrack.exception.ReconciliationPhase;
import com.lvfield.equiptrack.exception.ReconciliationPhaseException;
import com.lvfield.equiptrack.mapper.GlobalPartMapper;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.WireDropEquipmentLinkMapper;
import com.lvfield.equiptrack.model.EquipmentImportBatch;
import com.lvfield.equiptrack.model.GlobalPart;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.ProjectRoom;
import com.lvfield.equiptrack.model.WireDrop;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.service.EquipmentReconciliationService;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import com.lvfield.equiptrack.service.RoomService;
import com.lvfield.equiptrack.service.WireDropService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquipmentReconciliationServiceImpl Tests")
class EquipmentReconciliationServiceImplTest extends AbstractDatabaseTest {

    @Autowired
    private EquipmentReconciliationService reconciliationService;

    @Autowired
    private WireDropService wireDropService;

    @Autowired
    private RoomService roomService;

    @Autowired
    private MilestoneCacheService milestoneCacheService;

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private WireDropEquipmentLinkMapper linkMapper;

    @Autowired
    private GlobalPartMapper globalPartMapper;

    @Autowired
    private ObjectMapper objectMapper;

    private ProjectEquipment findByName(Integer projectId, String name) {
        return reconciliationService.listEquipment(projectId).stream()
                .filter(item -> item.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("equipment not found: " + name));
    }

    private List<WireDropEquipmentLink> linksOf(Integer wireDropId) {
        return linkMapper.selectList(new QueryWrapper<WireDropEquipmentLink>().eq("wire_drop_id", wireDropId));
    }

    @Test
    @DisplayName("Unchanged reimport of a qty-4 row restores both links")
    void testReimport_UnchangedRestoresAllLinks() {
        Integer projectId = createProject("Smith Residence");
        List<ParsedRow> rows = List.of(row("Living Room", "CAT6", "CAT6 Jack", 4));

        ReconciliationReport first = reconciliationService.reimport(projectId, rows);
        assertEquals(4, first.getInserted());
        assertEquals(1, first.getRoomsCreated());

        WireDrop drop = createDrop(projectId, "LR-01");
        ProjectEquipment jack1 = findByName(projectId, "CAT6 Jack #1");
        ProjectEquipment jack2 = findByName(projectId, "CAT6 Jack #2");
        wireDropService.linkEquipment(drop.getId(), jack1.getId(), "room_end", 0);
        wireDropService.linkEquipment(drop.getId(), jack2.getId(), "room_end", 1);

        ReconciliationReport second = reconciliationService.reimport(projectId, rows);

        assertEquals(4, second.getDeleted());
        assertEquals(4, second.getInserted());
        assertEquals(0, second.getRoomsCreated());
        assertEquals(2, second.getLinksSnapshotted());
        assertEquals(2, second.getLinksRestored());
        assertTrue(second.getLinksFailed().isEmpty());

        Set<String> linkedNames = linksOf(drop.getId()).stream()
                .map(link -> equipmentMapper.selectById(link.getProjectEquipmentId()).getName())
                .collect(Collectors.toSet());
        assertEquals(Set.of("CAT6 Jack #1", "CAT6 Jack #2"), linkedNames);
        assertNotEquals(jack1.getId(), findByName(projectId, "CAT6 Jack #1").getId());
    }

    @Test
    @DisplayName("Quantity expansion shares one instance group")
    void testReimport_InstanceExpansion() {
        Integer projectId = createProject("Expansion");
        reconciliationService.reimport(projectId, List.of(
                row("Office", "AP-1", "Access Point", 3),
                row("Office", "RJ45", "Patch Cord", 1)));

        List<ProjectEquipment> items = reconciliationService.listEquipment(projectId);
        assertEquals(4, items.size());
        List<ProjectEquipment> aps = items.stream()
                .filter(item -> item.getName().startsWith("Access Point #"))
                .collect(Collectors.toList());
        assertEquals(3, aps.size());
        assertEquals(1, aps.stream().map(ProjectEquipment::getInstanceGroupId).distinct().count());
        assertNotNull(aps.get(0).getInstanceGroupId());
        assertEquals(List.of(1, 2, 3), aps.stream().map(ProjectEquipment::getInstanceNumber).collect(Collectors.toList()));
        assertTrue(aps.stream().allMatch(item -> item.getPlannedQuantity() == 1));

        ProjectEquipment cord = findByName(projectId, "Patch Cord");
        assertNull(cord.getInstanceGroupId());
        assertNotNull(cord.getImportBatchId());
    }

    @Test
    @DisplayName("Changing one part number fails only the links to that item")
    void testReimport_PartChangeFailsOnlyThatItem() {
        Integer projectId = createProject("Part Change");
        reconciliationService.reimport(projectId, List.of(
                row("Living Room", "CAT6", "CAT6 Jack", 1),
                row("Living Room", "AP-1", "Access Point", 1)));

        WireDrop drop = createDrop(projectId, "LR-02");
        wireDropService.linkEquipment(drop.getId(), findByName(projectId, "CAT6 Jack").getId(), "room_end", 0);
        wireDropService.linkEquipment(drop.getId(), findByName(projectId, "Access Point").getId(), "room_end", 1);

        ReconciliationReport report = reconciliationService.reimport(projectId, List.of(
                row("Living Room", "CAT6", "CAT6 Jack", 1),
                row("Living Room", "AP-2", "Access Point", 1)));

        assertEquals(1, report.getLinksRestored());
        assertEquals(1, report.getLinksFailed().size());
        LinkRestoreFailure failure = report.getLinksFailed().get(0);
        assertEquals(LinkRestoreFailure.REASON_NOT_FOUND, failure.getReason());
        assertEquals(drop.getId(), failure.getWireDropId());
        assertEquals("LR-02", failure.getWireDropName());
        assertEquals("AP-1", failure.getPartNumber());
        assertEquals("Living Room", failure.getRoomName());
        assertEquals("Access Point / AP-1 / Living Room", failure.getDescribedEquipment());
        assertTrue(report.summary().contains("Access Point / AP-1 / Living Room"));
    }

    @Test
    @DisplayName("Manually created equipment and its links are never touched")
    void testReimport_ManualEquipmentUntouched() {
        Integer projectId = createProject("Manual");
        ProjectEquipment manual = new ProjectEquipment();
        manual.setProjectId(projectId);
        manual.setName("Owner Supplied TV");
        manual.setInstallSide("unspecified");
        manual.setPlannedQuantity(1);
        manual.setOrderedQuantity(0);
        manual.setReceivedQuantity(0);
        manual.setCreatedAt(LocalDateTime.now());
        equipmentMapper.insert(manual);
        WireDrop drop = createDrop(projectId, "TV-01");
        wireDropService.linkEquipment(drop.getId(), manual.getId(), "room_end", 0);

        ReconciliationReport report = reconciliationService.reimport(projectId, List.of(row("Den", "HDMI", "HDMI Plate", 1)));

        assertEquals(0, report.getDeleted());
        assertEquals(0, report.getLinksSnapshotted());
        assertNotNull(equipmentMapper.selectById(manual.getId()));
        assertEquals(1, linksOf(drop.getId()).size());
        assertEquals(2, reconciliationService.listEquipment(projectId).size());
    }

    @Test
    @DisplayName("Invalid rows are listed and labor rows are excluded")
    void testReimport_ValidationAndLabor() {
        Integer projectId = createProject("Validation");
        ParsedRow labor = row(null, null, "Install Labor", 8);
        labor.setLabor(true);

        ReconciliationReport report = reconciliationService.reimport(projectId, List.of(
                row("Kitchen", "SPK", "Ceiling Speaker", 1),
                labor,
                row("Kitchen", "SPK", "  ", 1),
                row("Kitchen", "SPK", "Subwoofer", 0)));

        assertEquals(1, report.getInserted());
        assertEquals(1, report.getLaborRowsSkipped());
        assertEquals(2, report.getSkippedRows().size());
        assertEquals(3, report.getSkippedRows().get(0).getRowNumber());
        assertEquals(4, report.getSkippedRows().get(1).getRowNumber());
        assertEquals("Subwoofer", report.getSkippedRows().get(1).getRowName());
    }

    @Test
    @DisplayName("Rooms are created once, keep their ids and drive the install side")
    void testReimport_RoomsAndInstallSide() {
        Integer projectId = createProject("Rooms");
        List<ParsedRow> rows = List.of(
                row("Living Room", "CAT6", "Jack A", 1),
                row(" living  room", "CAT6", "Jack B", 1),
                row("Network Closet", "PP-24", "Patch Panel", 1),
                row(null, "MISC", "Spare Keystone", 1));
        ParsedRow explicit = row("Living Room", "TV-MNT", "TV Mount", 1);
        explicit.setInstallationSide("head_end");

        ReconciliationReport first = reconciliationService.reimport(projectId,
                List.of(rows.get(0), rows.get(1), rows.get(2), rows.get(3), explicit));
        assertEquals(2, first.getRoomsCreated());
        List<ProjectRoom> rooms = roomService.listRooms(projectId);
        assertEquals(2, rooms.size());
        ProjectRoom closet = rooms.stream().filter(r -> r.getName().equals("Network Closet")).findFirst().orElseThrow();
        assertTrue(closet.getIsHeadend());

        assertEquals("room_end", findByName(projectId, "Jack A").getInstallSide());
        assertEquals(findByName(projectId, "Jack A").getRoomId(), findByName(projectId, "Jack B").getRoomId());
        assertEquals("head_end", findByName(projectId, "Patch Panel").getInstallSide());
        assertEquals("unspecified", findByName(projectId, "Spare Keystone").getInstallSide());
        assertNull(findByName(projectId, "Spare Keystone").getRoomId());
        assertEquals("head_end", findByName(projectId, "TV Mount").getInstallSide());

        ReconciliationReport second = reconciliationService.reimport(projectId, rows);
        assertEquals(0, second.getRoomsCreated());
        assertEquals(rooms.stream().map(ProjectRoom::getId).collect(Collectors.toSet()),
                roomService.listRooms(projectId).stream().map(ProjectRoom::getId).collect(Collectors.toSet()));
    }

    @Test
    @DisplayName("Catalog entries are matched case-insensitively and keep their prewire flag")
    void testReimport_CatalogSync() {
        GlobalPart existing = new GlobalPart();
        existing.setPartNumber("cat6-blue");
        existing.setName("CAT6 Cable Blue");
        existing.setRequiredForPrewire(true);
        globalPartMapper.insert(existing);
        Integer projectId = createProject("Catalog");

        ReconciliationReport report = reconciliationService.reimport(projectId, List.of(
                row("Office", "CAT6-BLUE", "Cable Run", 1),
                row("Office", "NEW-PART", "Widget", 2)));

        assertEquals(1, report.getPartsCreated());
        assertEquals(existing.getId(), findByName(projectId, "Cable Run").getGlobalPartId());
        assertTrue(globalPartMapper.selectById(existing.getId()).getRequiredForPrewire());
        Integer widgetPart = findByName(projectId, "Widget #1").getGlobalPartId();
        assertEquals(widgetPart, findByName(projectId, "Widget #2").getGlobalPartId());
        assertFalse(globalPartMapper.selectById(widgetPart).getRequiredForPrewire());
    }

    @Test
    @DisplayName("Colliding keys restore the first link and report the second as duplicate")
    void testReimport_DuplicateAfterReimport() {
        Integer projectId = createProject("Collision");
        List<ParsedRow> rows = List.of(
                row("Living Room", "CAT6", "Jack", 1),
                row("Living Room", "CAT6", "Jack", 1));
        reconciliationService.reimport(projectId, rows);
        List<ProjectEquipment> jacks = reconciliationService.listEquipment(projectId);
        assertEquals(2, jacks.size());

        WireDrop drop = createDrop(projectId, "LR-03");
        wireDropService.linkEquipment(drop.getId(), jacks.get(0).getId(), "room_end", 0);
        wireDropService.linkEquipment(drop.getId(), jacks.get(1).getId(), "room_end", 1);

        ReconciliationReport report = reconciliationService.reimport(projectId, rows);

        assertEquals(1, report.getLinksRestored());
        assertEquals(1, report.getLinksFailed().size());
        assertEquals(LinkRestoreFailure.REASON_DUPLICATE, report.getLinksFailed().get(0).getReason());
        List<WireDropEquipmentLink> links = linksOf(drop.getId());
        assertEquals(1, links.size());
        assertEquals(reconciliationService.listEquipment(projectId).get(0).getId(), links.get(0).getProjectEquipmentId());
    }

    @Test
    @DisplayName("Each reimport leaves a processed batch record with the report")
    void testReimport_BatchRecord() throws Exception {
        Integer projectId = createProject("Batches");
        ReconciliationReport report = reconciliationService.reimport(projectId, "proposal-v2.xlsx",
                List.of(row("Office", "CAT6", "Jack", 2)), 42);

        List<EquipmentImportBatch> batches = reconciliationService.listBatches(projectId);
        assertEquals(1, batches.size());
        EquipmentImportBatch batch = batches.get(0);
        assertEquals(report.getBatchId(), batch.getId());
        assertEquals(EquipmentImportBatch.STATUS_PROCESSED, batch.getStatus());
        assertEquals("proposal-v2.xlsx", batch.getFilename());
        assertEquals(42, batch.getCreatedBy());
        assertEquals(2, batch.getProcessedRows());
        assertNotNull(batch.getCompletedAt());

        JsonNode json = objectMapper.readTree(batch.getReportJson());
        assertEquals(2, json.get("inserted").asInt());
        assertTrue(reconciliationService.listEquipment(projectId).stream()
                .allMatch(item -> batch.getId().equals(item.getImportBatchId())));
    }

    @Test
    @DisplayName("Reimport invalidates the project's milestone cache")
    void testReimport_InvalidatesCache() {
        Integer projectId = createProject("Cache");
        milestoneCacheService.read(projectId).join();
        assertTrue(milestoneCacheService.get(projectId).isPresent());

        reconciliationService.reimport(projectId, List.of(row("Office", "CAT6", "Jack", 1)));

        assertFalse(milestoneCacheService.get(projectId).isPresent());
        assertEquals(0, milestoneCacheService.read(projectId).join().getTrimOrders());
        assertTrue(milestoneCacheService.get(projectId).isPresent());
    }

    @Test
    @DisplayName("A failed insert phase marks the batch failed, leaves no imported equipment and invalidates the cache")
    void testReimport_InsertPhaseFailure() {
        Integer projectId = createProject("Broken Sheet");
        reconciliationService.reimport(projectId, List.of(row("Office", "CAT6", "Jack", 2)));
        ProjectEquipment manual = new ProjectEquipment();
        manual.setProjectId(projectId);
        manual.setName("Customer Router");
        manual.setInstallSide("unspecified");
        manual.setPlannedQuantity(1);
        manual.setOrderedQuantity(0);
        manual.setReceivedQuantity(0);
        manual.setCreatedAt(LocalDateTime.now());
        equipmentMapper.insert(manual);
        milestoneCacheService.read(projectId).join();
        assertTrue(milestoneCacheService.get(projectId).isPresent());

        List<ParsedRow> rows = List.of(row("Office", "CAT6", "Jack", 1), row("Office", "AMP-1", "x".repeat(400), 1));
        ReconciliationPhaseException error = assertThrows(ReconciliationPhaseException.class,
                () -> reconciliationService.reimport(projectId, rows));

        assertEquals(ReconciliationPhase.REIMPORT, error.getPhase());
        assertTrue(error.requiresRetry());
        assertNotNull(error.getBatchId());

        EquipmentImportBatch batch = reconciliationService.listBatches(projectId).get(0);
        assertEquals(error.getBatchId(), batch.getId());
        assertEquals(EquipmentImportBatch.STATUS_FAILED, batch.getStatus());
        assertNotNull(batch.getErrorMessage());

        List<ProjectEquipment> remaining = reconciliationService.listEquipment(projectId);
        assertEquals(1, remaining.size());
        assertEquals("Customer Router", remaining.get(0).getName());
        assertFalse(remaining.get(0).isBatchTagged());
        assertFalse(milestoneCacheService.get(projectId).isPresent());
    }
}
