package org.abstractica.demo.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.abstractica.vaultbridge.BridgeClient;
import org.abstractica.vaultbridge.ConnectionState;
import org.abstractica.vaultbridge.ConnectionStatus;
import org.abstractica.vaultbridge.ExtensionTarget;
import org.abstractica.vaultbridge.NotAuthorizedException;
import org.abstractica.vaultbridge.RetryPolicy;
import org.abstractica.vaultbridge.VaultResponse;
import org.abstractica.vaultbridge.action.VaultAction;
import org.abstractica.vaultbridge.impl.client.DefaultBridgeClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line client for a vault bridge.
 *
 * <p>Connects, waits for the user to approve pairing in the vault, then
 * sends requests typed at the prompt and prints the decrypted responses.</p>
 */
public class DemoClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoClient.class);
    private static final String DEFAULT_URL = "ws://localhost:19455";
    private static final String DEFAULT_NAME = "Vault Bridge Demo";
    private static final String DEFAULT_EXTENSION_NAME = "Browser Extension";
    private static final Duration APPROVAL_TIMEOUT = Duration.ofMinutes(2);
    private static final long RESPONSE_WAIT_SECONDS = 60;

    private final BridgeClient client;
    private final ObjectWriter printer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public DemoClient(URI url, String name, ExtensionTarget target)
    {
        this.client = new DefaultBridgeClientFactory().builder()
                .bridgeUri(url)
                .clientName(name)
                .target(target)
                .build();

        client.onStateChange(this::printState);
    }

    private void printState(ConnectionState state)
    {
        System.out.println("[" + state.status() + "]"
                + state.getError().map(error -> " " + error).orElse(""));
    }

    public boolean connect()
    {
        System.out.println("Connecting to vault bridge...");
        System.out.println("Client id: " + client.getClientId());
        try
        {
            client.connect(RetryPolicy.fixed(5, Duration.ofSeconds(2)))
                    .get(RESPONSE_WAIT_SECONDS, TimeUnit.SECONDS);
        }
        catch (ExecutionException e)
        {
            System.out.println("Could not connect: " + e.getCause().getMessage());
            return false;
        }
        catch (TimeoutException e)
        {
            System.out.println("Could not connect: timed out");
            return false;
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            return false;
        }

        System.out.println("Waiting for pairing approval (approve this client in the vault)...");
        boolean authorized = client.waitForAuthorization(APPROVAL_TIMEOUT).join();
        if (!authorized)
        {
            System.out.println("Pairing was not approved");
            return false;
        }
        System.out.println("Paired! Type 'help' for commands.");
        return true;
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+", 2);
                String command = parts[0].toLowerCase();

                switch (command)
                {
                    case "items" ->
                    {
                        if (parts.length > 1)
                        {
                            send(new VaultAction.GetItems(parts[1]));
                        }
                        else
                        {
                            System.out.println("Usage: items <url>");
                        }
                    }
                    case "totp" ->
                    {
                        if (parts.length > 1)
                        {
                            send(new VaultAction.GetTotp(parts[1]));
                        }
                        else
                        {
                            System.out.println("Usage: totp <entry-id>");
                        }
                    }
                    case "passkeys" ->
                    {
                        if (parts.length > 1)
                        {
                            send(new VaultAction.PasskeyList(parts[1]));
                        }
                        else
                        {
                            System.out.println("Usage: passkeys <relying-party-id>");
                        }
                    }
                    case "config" -> send(new VaultAction.GetPasswordConfig());
                    case "presets" -> send(new VaultAction.GetPasswordPresets());
                    case "state" -> printState(client.getState());
                    case "stats" -> System.out.println(client.getStats());
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Disconnecting...");
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  items <url>         - List entries matching a URL");
                        System.out.println("  totp <entry-id>     - Get the current TOTP code of an entry");
                        System.out.println("  passkeys <rp-id>    - List passkeys for a relying party");
                        System.out.println("  config              - Show the password generator config");
                        System.out.println("  presets             - List password generator presets");
                        System.out.println("  state               - Show the connection state");
                        System.out.println("  stats               - Show request statistics");
                        System.out.println("  quit                - Disconnect and exit");
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command + " (type 'help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void send(VaultAction action)
    {
        CompletableFuture<VaultResponse> future = client.sendRequest(action, RetryPolicy.defaults());
        try
        {
            VaultResponse response = future.get(RESPONSE_WAIT_SECONDS, TimeUnit.SECONDS);
            if (response.success())
            {
                System.out.println(response.data().map(this::format).orElse("(no data)"));
            }
            else
            {
                System.out.println("Vault error: " + response.error().orElse("unknown"));
            }
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof NotAuthorizedException notAuthorized
                    && notAuthorized.getStatus() == ConnectionStatus.PENDING_APPROVAL)
            {
                System.out.println("Still waiting for pairing approval");
            }
            else
            {
                System.out.println("Request failed: " + cause.getMessage());
            }
        }
        catch (TimeoutException e)
        {
            System.out.println("No response from the vault");
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    private String format(Object data)
    {
        try
        {
            return printer.writeValueAsString(data);
        }
        catch (JsonProcessingException e)
        {
            return String.valueOf(data);
        }
    }

    public void disconnect()
    {
        client.close();
    }

    public static void main(String[] args)
    {
        String url = DEFAULT_URL;
        String name = DEFAULT_NAME;
        String extensionKeyFile = null;
        String extensionName = DEFAULT_EXTENSION_NAME;

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-u", "--url" ->
                {
                    if (i + 1 < args.length)
                    {
                        url = args[++i];
                    }
                }
                case "-n", "--name" ->
                {
                    if (i + 1 < args.length)
                    {
                        name = args[++i];
                    }
                }
                case "-k", "--extension-key" ->
                {
                    if (i + 1 < args.length)
                    {
                        extensionKeyFile = args[++i];
                    }
                }
                case "-e", "--extension-name" ->
                {
                    if (i + 1 < args.length)
                    {
                        extensionName = args[++i];
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-client [options]");
                    System.out.println("Options:");
                    System.out.println("  -u, --url <url>              Bridge URL (default: ws://localhost:19455)");
                    System.out.println("  -n, --name <name>            Client name shown in the vault");
                    System.out.println("  -k, --extension-key <file>   File with the extension's public key (required)");
                    System.out.println("  -e, --extension-name <name>  Extension name (default: Browser Extension)");
                    System.exit(0);
                }
                default -> System.err.println("Ignoring unknown option: " + args[i]);
            }
        }

        if (extensionKeyFile == null)
        {
            System.err.println("Missing --extension-key <file>");
            System.exit(1);
        }

        String extensionKey = loadExtensionKey(extensionKeyFile);
        if (extensionKey == null)
        {
            System.err.println("Failed to load extension public key from: " + extensionKeyFile);
            System.exit(1);
        }

        URI bridgeUri;
        try
        {
            bridgeUri = URI.create(url);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println("Invalid bridge URL: " + url);
            System.exit(1);
            return;
        }

        DemoClient demoClient = new DemoClient(bridgeUri, name, new ExtensionTarget(extensionKey, extensionName));
        if (demoClient.connect())
        {
            demoClient.runCommandLoop();
        }

        // Cleanup
        demoClient.disconnect();
    }

    private static String loadExtensionKey(String filename)
    {
        try
        {
            String key = Files.readString(Path.of(filename)).trim();
            return key.isEmpty() ? null : key;
        }
        catch (IOException e)
        {
            LOG.error("Failed to read extension key file: {}", filename, e);
            return null;
        }
    }
}
