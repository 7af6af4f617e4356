package ippnotify.server.printer;

import java.util.ArrayList;
import java.util.List;

import ippnotify.api.model.IppAttribute;

public class Printer {

    private final int id;
    private final String name;
    private volatile PrinterState state = PrinterState.IDLE;

    public Printer(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PrinterState getState() {
        return state;
    }

    void setState(PrinterState state) {
        this.state = state;
    }

    public List<IppAttribute> describe() {
        PrinterState current = state;
        List<IppAttribute> attrs = new ArrayList<>();
        attrs.add(IppAttribute.integer("printer-id", id));
        attrs.add(IppAttribute.name("printer-name", name));
        attrs.add(IppAttribute.enumValue("printer-state", current.getValue()));
        attrs.add(IppAttribute.keyword("printer-state-reasons", current == PrinterState.STOPPED ? "paused" : "none"));
        attrs.add(IppAttribute.bool("printer-is-accepting-jobs", current != PrinterState.STOPPED));
        return attrs;
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}
