package me.azat.probabilistic.exception;

public class DuplicateStructureException extends ProbabilisticStructureException {

    private final String name;

    public DuplicateStructureException(String name) {
        super(ErrorCode.DUPLICATE_STRUCTURE, "Structure '" + name + "' is already registered");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
