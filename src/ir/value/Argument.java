package ir.value;

import ir.type.Type;

public record Argument(String name, Type type) {

    public String toBril() {
        return name + ": " + type.toBril();
    }
}
