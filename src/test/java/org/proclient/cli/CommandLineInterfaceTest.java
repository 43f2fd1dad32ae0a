package org.proclient.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.proclient.catalog.CatalogLoader;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.contract.ContractEntitlement;
import org.proclient.contract.ContractInfo;
import org.proclient.operation.handler.EntitlementActionHandler;
import org.proclient.spi.IAttachmentStateStore;
import org.proclient.spi.IContractClient;
import org.proclient.spi.IPrivilegeChecker;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.spi.ServiceRegistry;
import org.proclient.state.AttachmentState;
import org.proclient.state.FileAttachmentStateStore;
import org.proclient.system.MachineIdProvider;
import org.proclient.system.RebootRequiredCheck;
import org.proclient.system.ReleaseInfo;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CommandLineInterfaceTest {

    private static final ReleaseInfo JAMMY = new ReleaseInfo("22.04", "jammy");

    @TempDir
    Path dataDir;

    @Mock
    private IContractClient contractClient;

    private FileAttachmentStateStore store;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        store = new FileAttachmentStateStore(dataDir);
    }

    private int run(final boolean root, final String... args) {
        return run(ConfigFactory.parseString("pro.features.allow_beta = false"), root, args);
    }

    private int run(final Config config, final boolean root, final String... args) {
        final ServiceCatalog catalog = CatalogLoader.loadDefault();
        final IPrivilegeChecker privilegeChecker = () -> root;
        final ServiceRegistry registry = new ServiceRegistry()
            .register(ObjectMapper.class, mapper)
            .register(ServiceCatalog.class, catalog)
            .register(IServiceActionHandler.class, new EntitlementActionHandler(catalog))
            .register(IAttachmentStateStore.class, store)
            .register(IContractClient.class, contractClient)
            .register(IPrivilegeChecker.class, privilegeChecker)
            .register(ReleaseInfo.class, JAMMY)
            .register(MachineIdProvider.class, new MachineIdProvider(dataDir))
            .register(RebootRequiredCheck.class, new RebootRequiredCheck(dataDir.resolve("reboot-required")));
        final CommandLineInterface cli = new CommandLineInterface(config, registry);

        final CommandLine commandLine = CommandLineInterface.createCommandLine(cli);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int run(final String... args) {
        return run(true, args);
    }

    private void attach(final Set<String> entitled, final Set<String> enabled) {
        store.save(new AttachmentState(true, entitled, enabled, "token", "cid", "Acme", "Acme Pro"));
    }

    @Test
    void commandName_isPro() {
        assertThat(CommandLineInterface.createCommandLine(new CommandLineInterface()).getCommandName())
            .isEqualTo("pro");
    }

    @Test
    void nonRootUser_isRejectedBeforeAnythingElse() {
        final int exitCode = run(false, "enable", "esm-infra", "--assume-yes", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().trim()).isEqualTo("This command must be run as root (try using sudo).");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void nonRootUser_isRejectedBeforeConfigurationIsRead() throws Exception {
        final Path brokenConfig = Files.writeString(dataDir.resolve("pro.conf"), "pro { data-dir = ");
        final CommandLine commandLine = CommandLineInterface.createCommandLine(new CommandLineInterface(() -> false));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        final int exitCode = commandLine.execute("-c", brokenConfig.toString(), "status");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().trim()).isEqualTo("This command must be run as root (try using sudo).");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void noSubcommand_printsUsageToTheConfiguredWriter() {
        final int exitCode = run();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("Usage: pro");
    }

    @Test
    void enableOnUnattachedMachine_printsTheSubscriptionMessage() {
        final int exitCode = run("enable", "esm-infra");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("To use 'esm-infra' you need an Ubuntu Pro subscription");
        assertThat(store.getStateFile()).doesNotExist();
    }

    @Test
    void enableUnknownServiceAsJson_reportsTheErrorOnStdout() throws Exception {
        final int exitCode = run("enable", "unknown", "--assume-yes", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        final JsonNode result = mapper.readTree(out.toString());
        assertThat(result.get("result").asText()).isEqualTo("failure");
        assertThat(result.get("errors").get(0).get("message_code").asText()).isEqualTo("invalid-service-or-failure");
        assertThat(result.get("errors").get(0).get("message").asText())
            .isEqualTo("Cannot enable unknown service 'unknown'.\nSee https://ubuntu.com/pro");
    }

    @Test
    void jsonFormatWithoutAssumeYes_isRejected() throws Exception {
        final int exitCode = run("disable", "livepatch", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        assertThat(mapper.readTree(out.toString()).get("errors").get(0).get("message_code").asText())
            .isEqualTo("json-format-require-assume-yes");
    }

    @Test
    void enableWithoutServices_reportsMissingServiceName() throws Exception {
        final int exitCode = run("enable", "--assume-yes", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        final JsonNode error = mapper.readTree(out.toString()).get("errors").get(0);
        assertThat(error.get("message_code").asText()).isEqualTo("missing-service-name");
        assertThat(error.get("type").asText()).isEqualTo("system");
    }

    @Test
    void enableOnAttachedMachine_persistsTheNewState() {
        attach(Set.of("livepatch", "esm-infra"), Set.of("esm-infra"));

        final int exitCode = run("enable", "livepatch");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Livepatch enabled");
        assertThat(store.load().enabledServices()).containsExactlyInAnyOrder("esm-infra", "livepatch");
    }

    @Test
    void partialFailure_persistsSuccessfulServicesAndExitsWithOne() throws Exception {
        attach(Set.of("livepatch", "fips"), Set.of());

        final int exitCode = run("enable", "fips", "livepatch", "--assume-yes", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        final JsonNode result = mapper.readTree(out.toString());
        assertThat(result.get("processed_services").toString()).isEqualTo("[\"livepatch\"]");
        assertThat(result.get("failed_services").toString()).isEqualTo("[\"fips\"]");
        assertThat(store.load().enabledServices()).containsExactly("livepatch");
    }

    @Test
    void helpForUnknownService_printsOnlyToStderr() {
        final int exitCode = run("help", "invalid-service", "--format", "json");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().trim()).isEqualTo("No help available for 'invalid-service'");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void helpForService_rendersJson() throws Exception {
        final int exitCode = run("help", "esm-infra", "--format", "json");

        assertThat(exitCode).isZero();
        final JsonNode help = mapper.readTree(out.toString());
        assertThat(help.get("name").asText()).isEqualTo("esm-infra");
        assertThat(help.get("available").asText()).isEqualTo("yes");
    }

    @Test
    void helpForService_rendersLabeledBlocks() {
        final int exitCode = run("help", "livepatch");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("Name:" + System.lineSeparator() + "livepatch");
        assertThat(out.toString()).contains("Available:" + System.lineSeparator() + "yes");
    }

    @Test
    void attach_enablesDefaultServicesAndReportsTheAccount() throws Exception {
        when(contractClient.attach(eq("contract-token"), anyString(), any())).thenReturn(new ContractInfo(
            "machine-token", "cid", "Acme Pro", "Acme", List.of(new ContractEntitlement("esm-infra", true, true))));

        final int exitCode = run("attach", "contract-token");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Ubuntu Pro: ESM Infra enabled")
            .contains("This machine is now attached to 'Acme'");
        assertThat(store.load().enabledServices()).containsExactly("esm-infra");
    }

    @Test
    void detach_whenUnattached_fails() {
        final int exitCode = run("detach");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("This machine is not attached to an Ubuntu Pro subscription.");
    }

    @Test
    void status_asJson_describesTheMachine() throws Exception {
        attach(Set.of("esm-infra"), Set.of("esm-infra"));

        final int exitCode = run("status", "--format", "json");

        assertThat(exitCode).isZero();
        final JsonNode status = mapper.readTree(out.toString());
        assertThat(status.get("attached").asBoolean()).isTrue();
        assertThat(status.get("account").asText()).isEqualTo("Acme");
    }

    @Test
    void status_listsBetaServicesOnlyWithAllOrWhenBetaIsAllowed() throws Exception {
        run("status", "--format", "json");
        assertThat(serviceNames(out.toString())).doesNotContain("realtime-kernel");

        out.getBuffer().setLength(0);
        run("status", "--all", "--format", "json");
        assertThat(serviceNames(out.toString())).contains("realtime-kernel");

        out.getBuffer().setLength(0);
        run(ConfigFactory.parseString("pro.features.allow_beta = true"), true, "status", "--format", "json");
        assertThat(serviceNames(out.toString())).contains("realtime-kernel");
    }

    private List<String> serviceNames(final String json) throws Exception {
        final List<String> names = new ArrayList<>();
        mapper.readTree(json).get("services").forEach(service -> names.add(service.get("name").asText()));
        return names;
    }

    @Test
    void invalidOption_exitsWithOne() {
        final int exitCode = run("enable", "esm-infra", "--format", "yaml");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid format 'yaml'");
    }
}
