package io.horizen.rawtx.tools.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public abstract class CommandProcessor {
    protected MessagePrinter printer;

    public CommandProcessor(MessagePrinter printer) {
        this.printer = printer;
    }

    protected abstract void processCommand(String input) throws Exception;

    protected abstract void printUsageMsg();

    // Command structure is:
    // 1) <command name>
    // 2) <command name> <json argument>
    protected Command parseCommand(String input) throws IOException {
        String[] inputData = input.trim().split(" ", 2);
        if (inputData.length == 0 || inputData[0].isEmpty())
            throw new IOException(String.format("error: unrecognized input structure '%s'.%nSee 'help' for usage guideline.", input));

        ObjectMapper objectMapper = new ObjectMapper();
        // Check for command without arguments
        if (inputData.length == 1)
            return new Command(inputData[0], objectMapper.createObjectNode());

        String jsonData = inputData[1].trim();

        JsonNode jsonNode;
        try {
            jsonNode = objectMapper.readTree(jsonData);
        } catch (Exception e) {
            throw new IOException(String.format("error: Invalid input data format '%s'. Json expected.%nSee 'help' for usage guideline.", jsonData));
        }

        return new Command(inputData[0], jsonNode);
    }

    protected void printUnsupportedCommandMsg(String command) {
        printer.print(String.format("Error: unsupported command '%s'.\nSee 'help' for usage guideline.", command));
    }
}
