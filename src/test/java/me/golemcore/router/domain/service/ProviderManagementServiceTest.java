package me.golemcore.router.domain.service;

import me.golemcore.router.domain.model.Decision;
import me.golemcore.router.domain.model.ProviderDescriptor;
import me.golemcore.router.domain.model.RegistryOutcome;
import me.golemcore.router.domain.model.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProviderManagementServiceTest {

    private ProviderRegistry registry;
    private ProviderManagementService service;
    private ProviderDescriptor calculator;
    private ProviderDescriptor weather;

    @BeforeEach
    void setUp() {
        registry = mock(ProviderRegistry.class);
        service = new ProviderManagementService(registry);

        calculator = ProviderDescriptor.builder()
                .id("calculator")
                .name("Calculator")
                .description("Basic arithmetic")
                .tools(new ArrayList<>(List.of(
                        ToolDescriptor.builder().name("add").description("Add two numbers").build())))
                .build();
        weather = ProviderDescriptor.builder()
                .id("weather")
                .name("Weather")
                .enabled(false)
                .path("mcp-servers/weather/weather.js")
                .build();

        when(registry.list()).thenReturn(List.of(calculator, weather));
        when(registry.get(anyString())).thenReturn(Optional.empty());
        when(registry.get("calculator")).thenReturn(Optional.of(calculator));
        when(registry.get("weather")).thenReturn(Optional.of(weather));
    }

    // ===== listProviders() =====

    @Test
    void shouldListProvidersWithToolsAndCommands() {
        String listing = service.listProviders();

        assertTrue(listing.startsWith("Available servers:\n\n"));
        assertTrue(listing.contains("Calculator (ID: calculator) - 🟢 Active\nDescription: Basic arithmetic\n"
                + "Tools:\n- add: Add two numbers\n"));
        assertTrue(listing.contains("Weather (ID: weather) - 🔴 Disabled\n"));
        assertTrue(listing.contains("- (discovered on first use)"));
        assertTrue(listing.contains("'activate server <id>'"));
        assertTrue(listing.contains("'install server <id>'"));
    }

    @Test
    void shouldSayWhenNoProvidersAreRegistered() {
        when(registry.list()).thenReturn(List.of());

        assertEquals("No servers are currently registered.", service.listProviders());
        assertEquals("No servers are currently registered.", service.providerStatus());
    }

    // ===== providerStatus() =====

    @Test
    void shouldGroupProvidersByStatus() {
        assertEquals("""
                Server Status:

                Active Servers (1):
                - Calculator (ID: calculator)

                Disabled Servers (1):
                - Weather (ID: weather)
                """, service.providerStatus());
    }

    // ===== setEnabled() =====

    @Test
    void shouldActivateDisabledProvider() {
        when(registry.setEnabled("weather", true)).thenReturn(RegistryOutcome.OK);

        String reply = service.setEnabled("weather", true);

        assertEquals("Server \"Weather\" has been activated and is now available for use.", reply);
        verify(registry).setEnabled("weather", true);
    }

    @Test
    void shouldDeactivateActiveProvider() {
        when(registry.setEnabled("calculator", false)).thenReturn(RegistryOutcome.OK);

        assertEquals("Server \"Calculator\" has been deactivated and will not be used for query routing.",
                service.setEnabled("calculator", false));
    }

    @Test
    void shouldReportAlreadyInRequestedState() {
        assertEquals("Server \"Calculator\" is already active.", service.setEnabled("calculator", true));
        assertEquals("Server \"Weather\" is already disabled.", service.setEnabled("weather", false));
        verify(registry, never()).setEnabled(anyString(), anyBoolean());
    }

    @Test
    void shouldReportUnknownProvider() {
        assertEquals("Server with ID \"ghost\" not found. Use 'list servers' to see available servers.",
                service.setEnabled("ghost", true));
    }

    // ===== remove() =====

    @Test
    void shouldRemoveProvider() {
        when(registry.remove("calculator", false)).thenReturn(RegistryOutcome.OK);

        assertEquals("Server \"Calculator\" has been removed.", service.remove("calculator", false));
    }

    @Test
    void shouldMentionDeletedFiles() {
        when(registry.remove("weather", true)).thenReturn(RegistryOutcome.OK);

        assertEquals("Server \"Weather\" has been removed and its files were deleted.",
                service.remove("weather", true));
    }

    @Test
    void shouldNotRemoveUnknownProvider() {
        assertTrue(service.remove("ghost", true).startsWith("Server with ID \"ghost\" not found."));
        verify(registry, never()).remove(anyString(), anyBoolean());
    }

    // ===== install() =====

    @Test
    void shouldReportInstallOutcome() {
        when(registry.installDependencies("weather")).thenReturn(RegistryOutcome.OK);
        when(registry.installDependencies("calculator")).thenReturn(RegistryOutcome.FAILED);

        assertEquals("Dependencies for server \"Weather\" have been installed.", service.install("weather"));
        assertTrue(service.install("calculator").startsWith("Installing dependencies for server \"Calculator\" failed."));
        assertTrue(service.install("ghost").startsWith("Server with ID \"ghost\" not found."));
    }

    // ===== handle() =====

    @Test
    void shouldHandleEveryManagementDecision() {
        when(registry.setEnabled(anyString(), anyBoolean())).thenReturn(RegistryOutcome.OK);
        when(registry.remove(anyString(), anyBoolean())).thenReturn(RegistryOutcome.OK);
        when(registry.installDependencies(anyString())).thenReturn(RegistryOutcome.OK);

        assertTrue(service.handle(new Decision.ListProviders()).isPresent());
        assertTrue(service.handle(new Decision.ProviderStatus()).isPresent());
        assertTrue(service.handle(new Decision.SetProviderEnabled("weather", true)).isPresent());
        assertTrue(service.handle(new Decision.RemoveProvider("calculator", false)).isPresent());
        assertTrue(service.handle(new Decision.InstallProviderDependencies("weather")).isPresent());
    }

    @Test
    void shouldIgnoreNonManagementDecisions() {
        assertTrue(service.handle(new Decision.DirectAnswer("hi")).isEmpty());
        assertTrue(service.handle(new Decision.InvokeTool("calculator", "add", Map.of(), List.of(), null)).isEmpty());
    }
}
