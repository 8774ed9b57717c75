package com.flagship.tool_ledger.inventory;

import com.flagship.tool_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class InventoryServiceTest {

    private LedgerFixture fixture;
    private InventoryService inventory;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        inventory = fixture.getInventory();
    }

    @Test
    @DisplayName("New tools are available, with their code indexed")
    void registerTool() {
        Tool tool = inventory.registerTool("tool#t0042", "Angle Grinder", "Bosch", "GWS 7");

        assertEquals("T0042", tool.getUniqueId());
        assertEquals(ToolStatus.AVAILABLE, tool.getStatus());
        assertNull(tool.getCurrentHolderRef());
        assertNotNull(tool.getCreatedAt());
        assertTrue(fixture.getStore().get(ItemDirectory.refFor("T0042")).exists());
        assertEquals("Bosch GWS 7 Angle Grinder", tool.getDisplayName());
    }

    @Test
    @DisplayName("Display names skip a missing brand or model")
    void displayNameSkipsBlankParts() {
        assertEquals("Bosch Angle Grinder", inventory.registerTool("T0043", "Angle Grinder", "Bosch", " ").getDisplayName());
        assertEquals("GWS 7 Grinder", inventory.registerTool("T0044", "Grinder", null, "GWS 7").getDisplayName());
        assertEquals("Grinder", inventory.registerTool("T0045", "Grinder", null, null).getDisplayName());
    }

    @Test
    @DisplayName("Codes are unique and must carry the right prefix")
    void registrationRules() {
        inventory.registerTool("T0042", "Angle Grinder", "Bosch", null);

        assertThrows(IllegalArgumentException.class, () -> inventory.registerTool("T0042", "Other", null, null));
        assertThrows(IllegalArgumentException.class, () -> inventory.registerTool("C0042", "Grinder", null, null));
        assertThrows(IllegalArgumentException.class,
            () -> inventory.registerConsumable("C1", "Tape", "roll", new BigDecimal("-1"), null));
        assertEquals(1, inventory.listTools().size());
    }

    @Test
    @DisplayName("Consumables start with their initial stock and flag low stock")
    void registerConsumable() {
        Consumable tape = inventory.registerConsumable("C0007", "Duct Tape", "roll", new BigDecimal("2"),
            new BigDecimal("3"));
        Consumable screws = inventory.registerConsumable("C0008", "Screws", "box", new BigDecimal("50"), null);

        assertTrue(tape.isLowStock());
        assertFalse(screws.isLowStock());
        assertEquals(0, BigDecimal.ZERO.compareTo(screws.getMinQuantity()));
        assertEquals(2, inventory.listConsumables().size());
    }

    @Test
    @DisplayName("Staff start active and can be deactivated")
    void staffActivation() {
        Staff staff = inventory.registerStaff("Wes Worker", "W1", null);

        assertTrue(staff.isActive());
        assertEquals(StaffRole.WORKER, staff.getRole());
        assertTrue(staff.getAssignedItemIds().isEmpty());

        assertFalse(inventory.setStaffActive(staff.getUid(), false).isActive());
        assertThrows(NoSuchElementException.class, () -> inventory.setStaffActive("missing", true));
    }

    @Test
    @DisplayName("Assigned tools are resolved from the holder's assignment list")
    void toolsAssignedTo() {
        Staff admin = fixture.admin("Ada Admin");
        Staff worker = fixture.staff("Wes Worker", "W1");
        Tool held = fixture.tool("T0001");
        fixture.tool("T0002");
        fixture.getCustody().checkout(held.getId(), worker.getUid(), admin.getUid());

        List<Tool> tools = inventory.findToolsAssignedTo(worker.getUid());

        assertEquals(List.of("T0001"), tools.stream().map(Tool::getUniqueId).toList());
        assertTrue(inventory.findToolsAssignedTo(admin.getUid()).isEmpty());
        assertThrows(NoSuchElementException.class, () -> inventory.findToolsAssignedTo("missing"));
    }
}
