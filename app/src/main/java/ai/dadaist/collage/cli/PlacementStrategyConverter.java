package ai.dadaist.collage.cli;

import ai.dadaist.collage.select.PlacementStrategy;
import picocli.CommandLine;

public class PlacementStrategyConverter implements CommandLine.ITypeConverter<PlacementStrategy> {

    @Override
    public PlacementStrategy convert(String value) {
        return PlacementStrategy.from(value);
    }
}
