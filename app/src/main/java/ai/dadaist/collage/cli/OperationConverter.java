package ai.dadaist.collage.cli;

import ai.dadaist.collage.config.Operation;
import picocli.CommandLine;

public class OperationConverter implements CommandLine.ITypeConverter<Operation> {

    @Override
    public Operation convert(String value) {
        return Operation.from(value);
    }
}
