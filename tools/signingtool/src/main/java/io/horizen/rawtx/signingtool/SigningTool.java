package io.horizen.rawtx.signingtool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.horizen.rawtx.settings.SettingsReader;
import io.horizen.rawtx.tools.utils.ConsolePrinter;
import io.horizen.rawtx.tools.utils.MessagePrinter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Command line entry point. An optional leading {@code --settings <file>} overrides the bundled configuration,
 * the rest of the arguments form the command.
 */
public class SigningTool {
    static final String SETTINGS_OPTION = "--settings";

    public static void main(String[] args) {
        MessagePrinter printer = new ConsolePrinter();

        try {
            Optional<String> settingsPath = Optional.empty();
            String[] commandArgs = args;
            if (args.length > 0 && args[0].equals(SETTINGS_OPTION)) {
                if (args.length < 2)
                    throw new IllegalArgumentException(SETTINGS_OPTION + " requires a config file path");
                settingsPath = Optional.of(args[1]);
                commandArgs = Arrays.copyOfRange(args, 2, args.length);
            }

            SettingsReader settingsReader = new SettingsReader(settingsPath);
            SigningToolCommandProcessor processor = new SigningToolCommandProcessor(printer, settingsReader.getSettings());
            processor.processCommand(commandArgs.length > 0 ? String.join(" ", commandArgs) : "help");
        } catch (Exception e) {
            ObjectNode resJson = new ObjectMapper().createObjectNode();
            resJson.put("error", e.getMessage());

            printer.print(resJson.toString());
        }
    }
}
