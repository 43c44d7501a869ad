package com.tablesmith.core.assets;

import java.util.List;

public interface DbAssetProvider {
    List<DbAsset> getAssets();
}
