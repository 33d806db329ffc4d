package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.model.GameServer;
import com.statsdb.statsdb_api.repository.GameServerRepository;
import com.statsdb.statsdb_api.view.ServerView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class ServerService extends EntityResolver<ServerView> {

    private final GameServerRepository serverRepository;

    public ServerService(GameServerRepository serverRepository) {
        this.serverRepository = serverRepository;
    }

    @Override
    public String kind() {
        return "server";
    }

    @Override
    public List<String> list() {
        return serverRepository.findHandles();
    }

    @Override
    public long count() {
        return serverRepository.countHandles();
    }

    @Override
    protected ServerView load(String handle) {
        List<Long> gameIds = serverRepository.findGameIdsByHandle(handle);
        if (gameIds.isEmpty()) {
            return new ServerView(handle, gameIds, null, null);
        }
        GameServer first = serverRepository
                .findFirstByGameIdAndHandle(gameIds.get(0), handle).orElse(null);
        GameServer latest = serverRepository
                .findFirstByGameIdAndHandle(gameIds.get(gameIds.size() - 1), handle).orElse(null);
        return new ServerView(handle, gameIds, first, latest);
    }
}
