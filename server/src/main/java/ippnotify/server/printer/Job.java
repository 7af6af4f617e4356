package ippnotify.server.printer;

import java.util.ArrayList;
import java.util.List;

import ippnotify.api.model.IppAttribute;

public class Job {

    private final int id;
    private final Printer printer;
    private final String name;
    private final String username;
    private volatile JobState state = JobState.PENDING;

    public Job(int id, Printer printer, String name, String username) {
        this.id = id;
        this.printer = printer;
        this.name = name;
        this.username = username;
    }

    public int getId() {
        return id;
    }

    public Printer getPrinter() {
        return printer;
    }

    public String getName() {
        return name;
    }

    public String getUsername() {
        return username;
    }

    public JobState getState() {
        return state;
    }

    void setState(JobState state) {
        this.state = state;
    }

    public List<IppAttribute> describe() {
        JobState current = state;
        List<IppAttribute> attrs = new ArrayList<>();
        attrs.add(IppAttribute.integer("job-id", id));
        attrs.add(IppAttribute.name("job-name", name));
        attrs.add(IppAttribute.name("job-originating-user-name", username));
        attrs.add(IppAttribute.enumValue("job-state", current.getValue()));
        attrs.add(IppAttribute.keyword("job-state-reasons", current == JobState.COMPLETED ? "job-completed-successfully" : "none"));
        attrs.add(IppAttribute.name("printer-name", printer.getName()));
        return attrs;
    }

    @Override
    public String toString() {
        return printer.getName() + "-" + id;
    }
}
