package com.wpanther.greengoods.dto.message;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A slash command, already split by the platform adapter into a name (without the slash) and arguments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandContent implements MessageContent {

    @NotBlank(message = "Command name is required")
    private String name;

    private List<String> args = new ArrayList<>();

    @Override
    public ContentType kind() {
        return ContentType.COMMAND;
    }

    public String arg(int index) {
        if (args == null || index >= args.size()) {
            return null;
        }
        return args.get(index);
    }
}
