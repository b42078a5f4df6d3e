package com.example.realm.session;

import com.example.realm.world.Heading;

public sealed interface Command {

    String name();

    record Move(Heading heading) implements Command {
        public String name() { return "move"; }
    }

    record ChangeHeading(Heading heading) implements Command {
        public String name() { return "heading"; }
    }

    record Attack(long target) implements Command {
        public String name() { return "attack"; }
    }

    record Cast(int spell, long target) implements Command {
        public String name() { return "cast"; }
    }

    record Drop(int slot, int qty) implements Command {
        public String name() { return "drop"; }
    }

    record DropGold(int qty) implements Command {
        public String name() { return "dropGold"; }
    }

    record UseItem(int slot) implements Command {
        public String name() { return "use"; }
    }

    record Pickup() implements Command {
        public String name() { return "pickup"; }
    }
}
